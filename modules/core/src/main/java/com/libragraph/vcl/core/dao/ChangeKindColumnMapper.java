package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.types.ChangeKind;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ChangeKindColumnMapper implements ColumnMapper<ChangeKind> {

    @Override
    public ChangeKind map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return ChangeKind.fromId(r.getShort(columnNumber));
    }
}
