package com.donorline.dispatch.model;

public enum CredentialOwnerType {
    STAFF,
    USER
}
