package com.company.sentinel.domain.enums;

public enum ProbeMethod {
    GET,
    HEAD;

    public boolean readsBody() {
        return this == GET;
    }
}
