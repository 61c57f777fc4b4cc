package com.questrail.lantern.store.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.lantern.api.StorageException;
import com.questrail.lantern.internal.time.SystemWallClock;
import com.questrail.lantern.internal.time.WallClock;
import com.questrail.lantern.model.GameUser;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.PasswordHint;
import com.questrail.lantern.model.SessionGameUser;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.store.CandidatePool;
import com.questrail.lantern.store.HackSessionStore;
import com.questrail.lantern.store.RoundGate;
import com.questrail.lantern.store.StationStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SqliteLanternStore
 * =============================================================================
 * JDBC/SQLite implementation of every collaborator port the engine consumes.
 *
 * <p>Session game users and game-user password lists are stored as JSON
 * columns. Each call opens its own connection; WAL mode lets the decay loop
 * and player requests read while another connection writes.</p>
 *
 * <p>{@link #init()} must be called once before use. It is idempotent.</p>
 *
 * <p>Rows that do not form a valid game user or session are reported as
 * {@link StorageException}. The {@code updated_at_ms} column of a session is
 * taken from the injected {@link WallClock}.</p>
 */
public final class SqliteLanternStore implements StationStore, HackSessionStore, CandidatePool, RoundGate {

    private final Path dbFile;
    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final WallClock wallClock;

    public SqliteLanternStore(Path dbFile, ObjectMapper mapper, WallClock wallClock) {
        this.dbFile = Objects.requireNonNull(dbFile, "dbFile").toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public SqliteLanternStore(Path dbFile, ObjectMapper mapper) {
        this(dbFile, mapper, SystemWallClock.INSTANCE);
    }

    public void init() {
        try {
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create directory for " + dbFile, e);
        }

        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS stations (
                        station_id INTEGER PRIMARY KEY,
                        signal_value INTEGER NOT NULL,
                        is_active INTEGER NOT NULL DEFAULT 1
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS game_users (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        station_id INTEGER NOT NULL,
                        user_name TEXT NOT NULL,
                        passwords TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS fake_passwords (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        password TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS hack_sessions (
                        owner TEXT PRIMARY KEY,
                        station_id INTEGER NOT NULL,
                        game_users TEXT NOT NULL,
                        tries_left INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS lantern_round (
                        round_id INTEGER PRIMARY KEY CHECK (round_id = 1),
                        is_active INTEGER NOT NULL,
                        start_time_ms INTEGER,
                        end_time_ms INTEGER
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_game_users_station ON game_users(station_id)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema", e);
        }
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    // ---------------------------------------------------------------------
    // Seeding
    // ---------------------------------------------------------------------

    public void upsertStation(Station station) {
        String sql = "INSERT OR REPLACE INTO stations(station_id,signal_value,is_active) VALUES(?,?,?)";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, station.stationId());
            ps.setInt(2, station.signalValue());
            ps.setInt(3, station.isActive() ? 1 : 0);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to store station " + station.stationId(), e);
        }
    }

    public void addGameUser(GameUser gameUser) {
        String sql = "INSERT INTO game_users(station_id,user_name,passwords) VALUES(?,?,?)";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, gameUser.stationId());
            ps.setString(2, gameUser.userName());
            ps.setString(3, mapper.writeValueAsString(gameUser.passwords()));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to store game user " + gameUser.userName(), e);
        }
    }

    public void addFillerPasswords(List<String> passwords) {
        String sql = "INSERT INTO fake_passwords(password) VALUES(?)";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (String password : passwords) {
                ps.setString(1, password);
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new StorageException("Failed to store filler passwords", e);
        }
    }

    public void setRound(LanternRound round) {
        String sql = "INSERT OR REPLACE INTO lantern_round(round_id,is_active,start_time_ms,end_time_ms) VALUES(1,?,?,?)";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, round.isActive() ? 1 : 0);
            setNullableInstant(ps, 2, round.startTime());
            setNullableInstant(ps, 3, round.endTime());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to store lantern round", e);
        }
    }

    // ---------------------------------------------------------------------
    // StationStore
    // ---------------------------------------------------------------------

    @Override
    public Optional<Station> getStation(int stationId) {
        String sql = "SELECT station_id,signal_value,is_active FROM stations WHERE station_id=?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, stationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toStation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read station " + stationId, e);
        }
    }

    @Override
    public boolean setSignalValue(int stationId, int signalValue) {
        String sql = "UPDATE stations SET signal_value=? WHERE station_id=?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, signalValue);
            ps.setInt(2, stationId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to update signal value of station " + stationId, e);
        }
    }

    @Override
    public List<Station> getAllStations() {
        String sql = "SELECT station_id,signal_value,is_active FROM stations ORDER BY station_id";
        List<Station> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toStation(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list stations", e);
        }
    }

    // ---------------------------------------------------------------------
    // HackSessionStore
    // ---------------------------------------------------------------------

    @Override
    public Optional<HackSession> getSession(String owner) {
        String sql = "SELECT owner,station_id,game_users,tries_left FROM hack_sessions WHERE owner=?";
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new HackSession(
                        rs.getString("owner"),
                        rs.getInt("station_id"),
                        readGameUsers(rs.getString("game_users")),
                        rs.getInt("tries_left")
                ));
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to read hack session of " + owner, e);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new StorageException("Invalid hack session row for " + owner, e);
        }
    }

    @Override
    public void upsertSession(HackSession session) {
        String sql = """
                INSERT INTO hack_sessions(owner,station_id,game_users,tries_left,updated_at_ms)
                VALUES(?,?,?,?,?)
                ON CONFLICT(owner) DO UPDATE SET
                    station_id=excluded.station_id,
                    game_users=excluded.game_users,
                    tries_left=excluded.tries_left,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, session.owner());
            ps.setInt(2, session.stationId());
            ps.setString(3, writeGameUsers(session.gameUsers()));
            ps.setInt(4, session.triesLeft());
            ps.setLong(5, wallClock.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to store hack session of " + session.owner(), e);
        }
    }

    @Override
    public boolean deleteSession(String owner) {
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM hack_sessions WHERE owner=?")) {
            ps.setString(1, owner);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete hack session of " + owner, e);
        }
    }

    // ---------------------------------------------------------------------
    // CandidatePool
    // ---------------------------------------------------------------------

    @Override
    public List<GameUser> getCandidates(int stationId) {
        String sql = "SELECT station_id,user_name,passwords FROM game_users WHERE station_id=? ORDER BY id";
        List<GameUser> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, stationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    List<String> passwords = new ArrayList<>();
                    for (JsonNode node : mapper.readTree(rs.getString("passwords"))) {
                        passwords.add(node.asText());
                    }
                    out.add(new GameUser(rs.getInt("station_id"), rs.getString("user_name"), passwords));
                }
            }
            return out;
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to read game users of station " + stationId, e);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Invalid game user row for station " + stationId, e);
        }
    }

    @Override
    public List<String> getFillerPasswords() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT password FROM fake_passwords ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString("password"));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read filler passwords", e);
        }
    }

    // ---------------------------------------------------------------------
    // RoundGate
    // ---------------------------------------------------------------------

    @Override
    public LanternRound currentRound() {
        String sql = "SELECT is_active,start_time_ms,end_time_ms FROM lantern_round WHERE round_id=1";
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return LanternRound.inactive();
            }
            return new LanternRound(
                    rs.getInt("is_active") == 1,
                    readNullableInstant(rs, "start_time_ms"),
                    readNullableInstant(rs, "end_time_ms")
            );
        } catch (SQLException e) {
            throw new StorageException("Failed to read lantern round", e);
        }
    }

    // ---------------------------------------------------------------------
    // Row mapping
    // ---------------------------------------------------------------------

    private static Station toStation(ResultSet rs) throws SQLException {
        return new Station(rs.getInt("station_id"), rs.getInt("signal_value"), rs.getInt("is_active") == 1);
    }

    private String writeGameUsers(List<SessionGameUser> gameUsers) throws JsonProcessingException {
        ArrayNode array = mapper.createArrayNode();
        for (SessionGameUser user : gameUsers) {
            ObjectNode node = array.addObject();
            node.put("userName", user.userName());
            node.put("password", user.password());
            node.putObject("passwordHint")
                    .put("index", user.passwordHint().index())
                    .put("character", String.valueOf(user.passwordHint().character()));
            node.put("isCorrect", user.correct());
        }
        return mapper.writeValueAsString(array);
    }

    private List<SessionGameUser> readGameUsers(String json) throws JsonProcessingException {
        List<SessionGameUser> out = new ArrayList<>();
        for (JsonNode node : mapper.readTree(json)) {
            JsonNode hint = node.path("passwordHint");
            out.add(new SessionGameUser(
                    node.path("userName").asText(),
                    node.path("password").asText(),
                    new PasswordHint(hint.path("index").asInt(), hint.path("character").asText().charAt(0)),
                    node.path("isCorrect").asBoolean(false)
            ));
        }
        return out;
    }

    private static void setNullableInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant readNullableInstant(ResultSet rs, String column) throws SQLException {
        long ms = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(ms);
    }
}
