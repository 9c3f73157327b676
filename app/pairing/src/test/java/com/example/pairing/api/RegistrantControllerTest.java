package com.example.pairing.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.pairing.api.request.RegisterRequest;
import com.example.pairing.api.response.FieldViolation;
import com.example.pairing.api.response.MatchStatusResponse;
import com.example.pairing.api.response.PartnerSummary;
import com.example.pairing.api.response.RegistrantResponse;
import com.example.pairing.api.response.RegistrationResponse;
import com.example.pairing.service.MatchingService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RegistrantController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class RegistrantControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchingService matchingService;

  private static RegistrantResponse user(boolean matched, String matchedWith) {
    return new RegistrantResponse(
        "r-2",
        "Bob",
        "bob@school.edu",
        "bb222",
        "CS",
        2027,
        matched,
        matchedWith,
        "2026-03-01T09:00:00Z",
        "2026-03-01T09:00:00Z");
  }

  @Test
  void registerReturnsMatchedPayload() throws Exception {
    when(matchingService.registerAndMatch(any(RegisterRequest.class)))
        .thenReturn(
            new RegistrationResponse(
                true,
                user(true, "r-1"),
                new PartnerSummary("Alice", "alice@school.edu", "CS", 2026)));

    mockMvc
        .perform(
            post("/api/users")
                .header("X-Request-Id", "req-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Bob","email":"bob@school.edu","netId":"bb222",
                     "major":"CS","graduationYear":2027}
                    """))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "req-1"))
        .andExpect(jsonPath("$.matched").value(true))
        .andExpect(jsonPath("$.user.id").value("r-2"))
        .andExpect(jsonPath("$.user.isMatched").value(true))
        .andExpect(jsonPath("$.user.matchedWith").value("r-1"))
        .andExpect(jsonPath("$.match.email").value("alice@school.edu"))
        .andExpect(jsonPath("$.match.graduationYear").value(2026))
        .andExpect(jsonPath("$.match.isMatched").doesNotExist());
  }

  @Test
  void registerOmitsMatchWhenPending() throws Exception {
    when(matchingService.registerAndMatch(any(RegisterRequest.class)))
        .thenReturn(new RegistrationResponse(false, user(false, null), null));

    mockMvc
        .perform(
            post("/api/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Bob","email":"bob@school.edu","netId":"bb222",
                     "major":"CS","graduationYear":2027}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.matched").value(false))
        .andExpect(jsonPath("$.user.isMatched").value(false))
        .andExpect(jsonPath("$.match").doesNotExist());
  }

  @Test
  void registerReturns400NamingMissingMajor() throws Exception {
    when(matchingService.registerAndMatch(any(RegisterRequest.class)))
        .thenThrow(
            new RegistrantValidationException(List.of(new FieldViolation("major", "is required"))));

    mockMvc
        .perform(
            post("/api/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Bob","email":"bob@school.edu","netId":"bb222","graduationYear":2027}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PAIRING_VALIDATION_ERROR"))
        .andExpect(jsonPath("$.error").value("validation failed"))
        .andExpect(jsonPath("$.details[0].field").value("major"));
  }

  @Test
  void registerPassesFractionalYearThroughUntruncated() throws Exception {
    when(matchingService.registerAndMatch(any(RegisterRequest.class)))
        .thenReturn(new RegistrationResponse(false, user(false, null), null));

    mockMvc
        .perform(
            post("/api/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Bob","email":"bob@school.edu","netId":"bb222",
                     "major":"CS","graduationYear":2027.9}
                    """))
        .andExpect(status().isOk());

    final ArgumentCaptor<RegisterRequest> captor = ArgumentCaptor.forClass(RegisterRequest.class);
    verify(matchingService).registerAndMatch(captor.capture());
    assertThat(captor.getValue().graduationYear().decimalValue())
        .isEqualByComparingTo(new BigDecimal("2027.9"));
  }

  @Test
  void registerReturns400ForMalformedJson() throws Exception {
    mockMvc
        .perform(
            post("/api/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Bob\","))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PAIRING_BAD_REQUEST"));
    verify(matchingService, never()).registerAndMatch(any());
  }

  @Test
  void getMatchReturnsPartner() throws Exception {
    when(matchingService.queryMatch("r-1"))
        .thenReturn(
            new MatchStatusResponse(
                true, new PartnerSummary("Bob", "bob@school.edu", "CS", 2027)));

    mockMvc
        .perform(get("/api/users/r-1/match"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.matched").value(true))
        .andExpect(jsonPath("$.match.name").value("Bob"));
  }

  @Test
  void getMatchReturns404ForUnknownId() throws Exception {
    when(matchingService.queryMatch("nope")).thenThrow(new RegistrantNotFoundException("nope"));

    mockMvc
        .perform(get("/api/users/nope/match"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("PAIRING_REGISTRANT_NOT_FOUND"))
        .andExpect(jsonPath("$.error").value("registrant not found: nope"));
  }

  @Test
  void getMatchReturns500WhenStorageIsDown() throws Exception {
    when(matchingService.queryMatch("r-1"))
        .thenThrow(new StorageUnavailableException("storage is unavailable"));

    mockMvc
        .perform(get("/api/users/r-1/match"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("PAIRING_STORAGE_UNAVAILABLE"));
  }

  @Test
  void rootReportsHealthy() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }
}
