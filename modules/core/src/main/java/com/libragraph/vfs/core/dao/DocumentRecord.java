package com.libragraph.vfs.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record DocumentRecord(
        @ColumnName("id") String id,
        @ColumnName("doctype") String doctype,
        @ColumnName("rev") String rev,
        @ColumnName("body") String body
) {}
