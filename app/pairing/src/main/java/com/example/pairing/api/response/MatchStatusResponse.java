package com.example.pairing.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchStatusResponse(boolean matched, PartnerSummary match) {

  public static MatchStatusResponse unmatched() {
    return new MatchStatusResponse(false, null);
  }
}
