package com.acme.render.pg;

import java.sql.PreparedStatement;
import java.sql.SQLException;

interface SqlApplier {
    void apply(PreparedStatement ps) throws SQLException;
}
