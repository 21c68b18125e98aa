package com.example.foottraffic.analysis;

public enum ZoneType {
    COUNTING, ENTRY, EXIT, EXCLUSION
}
