package com.resellerhub.credits.model;

public enum SortDirection {
    ASC,
    DESC
}
