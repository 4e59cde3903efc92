// file: sqlserver/src/main/java/io/schemasync/sqlserver/ServerBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/** The instance itself: only ever the root of a live tree. */
final class ServerBehavior extends SqlServerBehavior {

    ServerBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.SERVER;
    }

    @Override
    public List<String> listNames(ReflectedNode parent) {
        return List.of();
    }

    @Override
    public boolean exists(ReflectedNode parent, String name) {
        return false;
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode node) {
        return node.driver().queryOne(SqlServerStatements.SERVER_NAME);
    }

    @Override
    public boolean supportsRename() {
        return false;
    }

    @Override
    public boolean delete(ReflectedNode node) {
        return false;
    }

    @Override
    public boolean canDelete(ReflectedNode node) {
        return false;
    }
}
