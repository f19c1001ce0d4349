package com.saddlery.auth.audit;

public enum AuditAction {
    LOGIN,
    LOGOUT
}
