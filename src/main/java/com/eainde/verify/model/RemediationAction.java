package com.eainde.verify.model;

public enum RemediationAction {
    ADD,
    MODIFY,
    REMOVE,
    CONFIGURE
}
