package com.leadnurture.model;

public enum EmploymentStatus {
    EMPLOYED,
    PART_TIME,
    UNEMPLOYED,
    UNKNOWN
}
