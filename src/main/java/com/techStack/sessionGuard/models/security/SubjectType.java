package com.techStack.sessionGuard.models.security;

public enum SubjectType {
    USER,
    IP
}
