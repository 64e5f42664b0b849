package com.autonomous.treasury.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Attribution attached to a spend or an earning: which tool the money went to,
 * what it was expected to return and what it actually returned (minor units).
 */
@Value
@Builder
@Jacksonized
public class RoiData {
    String toolUsed;
    Long expectedValue;
    Long realizedValue;
}
