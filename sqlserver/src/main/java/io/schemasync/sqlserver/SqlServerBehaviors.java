// file: sqlserver/src/main/java/io/schemasync/sqlserver/SqlServerBehaviors.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.BehaviorTable;

import java.time.Clock;
import java.util.List;

/**
 * Behavior table for SQL Server. All behaviors of one table share a
 * {@link DatabaseScope}, so build one table per connection.
 */
public final class SqlServerBehaviors {

    private SqlServerBehaviors() {
    }

    public static BehaviorTable create() {
        return create(Clock.systemDefaultZone());
    }

    /** @param clock "today" for partitions created on empty tables */
    public static BehaviorTable create(Clock clock) {
        DatabaseScope scope = new DatabaseScope();
        return BehaviorTable.of(List.of(
                new ServerBehavior(scope),
                new LoginBehavior(scope),
                new DatabaseBehavior(scope),
                new SchemaBehavior(scope),
                new UserBehavior(scope),
                new TableBehavior(scope),
                new ColumnBehavior(scope),
                new PrimaryKeyBehavior(scope),
                new IndexBehavior(scope),
                new ForeignKeyBehavior(scope),
                new PartitionBehavior(scope, clock)));
    }
}
