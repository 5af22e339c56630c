package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.types.ChangeKind;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ChangeKindArgumentFactory extends AbstractArgumentFactory<ChangeKind> {

    public ChangeKindArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(ChangeKind value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
