package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.types.StorageKind;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class StorageKindColumnMapper implements ColumnMapper<StorageKind> {

    @Override
    public StorageKind map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return StorageKind.fromId(r.getShort(columnNumber));
    }
}
