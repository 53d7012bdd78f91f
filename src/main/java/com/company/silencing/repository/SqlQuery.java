package com.company.silencing.repository;

import lombok.Value;

@Value
public class SqlQuery {
    String sql;
    Object[] args;
}
