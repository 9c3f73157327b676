package com.example.pairing.api.response;

import com.example.pairing.model.RegistrantRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistrantResponse(
    String id,
    String name,
    String email,
    String netId,
    String major,
    int graduationYear,
    @JsonProperty("isMatched") boolean isMatched,
    String matchedWith,
    String createdAt,
    String updatedAt) {

  public static RegistrantResponse of(RegistrantRecord record) {
    return new RegistrantResponse(
        record.id(),
        record.name(),
        record.email(),
        record.netId(),
        record.major(),
        record.graduationYear(),
        record.matched(),
        record.matchedWith(),
        record.createdAt() == null ? null : record.createdAt().toString(),
        record.updatedAt() == null ? null : record.updatedAt().toString());
  }
}
