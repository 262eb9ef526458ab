package com.leadnurture.model;

public enum ChatRole {
    USER,
    ASSISTANT
}
