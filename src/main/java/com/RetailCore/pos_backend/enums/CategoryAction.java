package com.RetailCore.pos_backend.enums;

public enum CategoryAction {
    ADD,
    REPLACE,
    REMOVE
}
