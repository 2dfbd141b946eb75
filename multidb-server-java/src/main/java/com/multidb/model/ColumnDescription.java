package com.multidb.model;

import lombok.Data;

@Data
public class ColumnDescription {
    private final String name;
    private final String type;
}
