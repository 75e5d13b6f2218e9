package com.techStack.sessionGuard.models.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum LoginType {

    PASSWORD("password", SecurityLevel.STANDARD),
    SOCIAL("social", SecurityLevel.STANDARD),
    OTP("otp", SecurityLevel.HIGH),
    REMEMBER_ME("remember_me", SecurityLevel.LOW);

    private final String value;
    private final SecurityLevel defaultSecurityLevel;

    LoginType(String value, SecurityLevel defaultSecurityLevel) {
        this.value = value;
        this.defaultSecurityLevel = defaultSecurityLevel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LoginType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown login type: " + value));
    }
}
