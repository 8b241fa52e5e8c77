package com.ofacwatch.screening.domain;

public enum SourceType {
    RSS
}
