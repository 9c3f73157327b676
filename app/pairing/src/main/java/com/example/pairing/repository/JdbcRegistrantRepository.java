package com.example.pairing.repository;

import static com.example.common.JdbcTimestampUtils.readInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pairing.model.RegistrantRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRegistrantRepository implements RegistrantRepository {

  private static final String COLUMNS =
      """
      id, name, email, net_id, major, graduation_year, is_matched, matched_with,
      created_at, updated_at
      """;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NamedParameterJdbcTemplate は Spring 管理の共有コンポーネントのため")
  private final NamedParameterJdbcTemplate jdbcTemplate;

  public JdbcRegistrantRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<RegistrantRecord> findById(String id) {
    return findOneBy("id", id);
  }

  @Override
  public Optional<RegistrantRecord> findByEmail(String email) {
    return findOneBy("email", email);
  }

  @Override
  public Optional<RegistrantRecord> findByNetId(String netId) {
    return findOneBy("net_id", netId);
  }

  @Override
  public RegistrantRecord insert(RegistrantRecord record) {
    final String sql =
        """
        INSERT INTO registrants (id, name, email, net_id, major, graduation_year,
                                 is_matched, matched_with, created_at, updated_at)
        VALUES (:id, :name, :email, :netId, :major, :graduationYear,
                FALSE, NULL, :createdAt, :updatedAt)
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("name", record.name())
            .addValue("email", record.email())
            .addValue("netId", record.netId())
            .addValue("major", record.major())
            .addValue("graduationYear", record.graduationYear())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public Optional<RegistrantRecord> findUnmatchedCandidate(String excludeId, String major) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("excludeId", excludeId);
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM registrants WHERE is_matched = FALSE AND id <> :excludeId");
    if (major != null) {
      sql.append(" AND major = :major");
      params.addValue("major", major);
    }
    sql.append(" LIMIT 1");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean claimPair(String registrantId, String candidateId, Instant matchedAt) {
    // 行ロックは id 順に取り、再評価後も未マッチの行が 2 件揃った場合だけ更新する
    final String sql =
        """
        WITH locked AS (
            SELECT id FROM registrants
            WHERE id IN (:registrantId, :candidateId) AND is_matched = FALSE
            ORDER BY id
            FOR UPDATE
        )
        UPDATE registrants r
        SET is_matched = TRUE,
            matched_with = CASE WHEN r.id = :registrantId THEN :candidateId ELSE :registrantId END,
            updated_at = :matchedAt
        WHERE r.id IN (SELECT id FROM locked)
          AND (SELECT COUNT(*) FROM locked) = 2
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("registrantId", registrantId)
            .addValue("candidateId", candidateId)
            .addValue("matchedAt", toTimestamp(matchedAt));
    return jdbcTemplate.update(sql, params) == 2;
  }

  @Override
  public int updateMatchState(
      String id, String expectedPartnerId, String newPartnerId, Instant updatedAt) {
    final String sql =
        """
        UPDATE registrants
        SET is_matched = :matched,
            matched_with = CAST(:newPartnerId AS VARCHAR),
            updated_at = :updatedAt
        WHERE id = :id
          AND matched_with IS NOT DISTINCT FROM CAST(:expectedPartnerId AS VARCHAR)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("matched", newPartnerId != null)
            .addValue("newPartnerId", newPartnerId)
            .addValue("expectedPartnerId", expectedPartnerId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<RegistrantRecord> findAsymmetricMatches(int limit) {
    final String sql =
        """
        SELECT r.id, r.name, r.email, r.net_id, r.major, r.graduation_year,
               r.is_matched, r.matched_with, r.created_at, r.updated_at
        FROM registrants r
        LEFT JOIN registrants p ON p.id = r.matched_with
        WHERE r.is_matched = TRUE
          AND (p.id IS NULL OR p.matched_with IS DISTINCT FROM r.id)
        LIMIT :limit
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  @Override
  public long countUnmatched() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM registrants WHERE is_matched = FALSE",
            new MapSqlParameterSource(),
            Long.class);
    return count == null ? 0 : count;
  }

  private Optional<RegistrantRecord> findOneBy(String column, String value) {
    if (value == null) {
      return Optional.empty();
    }
    final String sql = "SELECT " + COLUMNS + " FROM registrants WHERE " + column + " = :value";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("value", value), this::mapRow)
        .stream()
        .findFirst();
  }

  private RegistrantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RegistrantRecord(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("net_id"),
        rs.getString("major"),
        rs.getInt("graduation_year"),
        rs.getBoolean("is_matched"),
        rs.getString("matched_with"),
        readInstant(rs, "created_at"),
        readInstant(rs, "updated_at"));
  }
}
