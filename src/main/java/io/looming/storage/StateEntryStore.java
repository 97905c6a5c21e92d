package io.looming.storage;

import io.looming.state.StatePersistence;
import io.looming.state.StateScope;
import io.looming.state.StateValue;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQLite-backed state entries. Later writes to the same scope and key overwrite.
 */
public final class StateEntryStore implements StatePersistence {
    private final Database database;

    public StateEntryStore(Database database) {
        this.database = database;
    }

    @Override
    public void save(StateScope scope, String key, StateValue value, long nowMs) {
        database.withConnection("save state entry", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO state_entries(scope_type,scope_id,state_key,value_kind,value,updated_at_ms)
                    VALUES(?,?,?,?,?,?)
                    ON CONFLICT(scope_type,scope_id,state_key)
                    DO UPDATE SET value_kind=excluded.value_kind,value=excluded.value,updated_at_ms=excluded.updated_at_ms
                    """)) {
                ps.setString(1, scope.type().name());
                ps.setString(2, scope.id());
                ps.setString(3, key);
                ps.setString(4, value.kind().name());
                ps.setString(5, value.encode());
                ps.setLong(6, nowMs);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Map<String, StateValue> loadScope(StateScope scope) {
        return database.withConnection("load state scope", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT state_key,value_kind,value FROM state_entries WHERE scope_type=? AND scope_id=? ORDER BY state_key")) {
                ps.setString(1, scope.type().name());
                ps.setString(2, scope.id());
                Map<String, StateValue> out = new LinkedHashMap<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.put(rs.getString("state_key"),
                                StateValue.decode(StateValue.Kind.valueOf(rs.getString("value_kind")), rs.getString("value")));
                    }
                }
                return out;
            }
        });
    }
}
