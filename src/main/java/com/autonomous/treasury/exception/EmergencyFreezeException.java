package com.autonomous.treasury.exception;

import com.autonomous.treasury.model.DenialReason;

public class EmergencyFreezeException extends PolicyDenialException {

    public EmergencyFreezeException(String agentId, String freezeReason) {
        super(agentId, DenialReason.EMERGENCY_FREEZE,
            "Operation blocked: " + (freezeReason != null ? freezeReason : "emergency freeze active"));
    }
}
