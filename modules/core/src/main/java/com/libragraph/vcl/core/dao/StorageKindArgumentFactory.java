package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.types.StorageKind;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class StorageKindArgumentFactory extends AbstractArgumentFactory<StorageKind> {

    public StorageKindArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(StorageKind value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
