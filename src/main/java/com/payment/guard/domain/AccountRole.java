package com.payment.guard.domain;

public enum AccountRole {
    CUSTOMER,
    SUPPLIER,
    ADMIN
}
