package com.trackflow.repository;

import com.trackflow.model.TagListConverter;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Plain JDBC access to another environment's {@code tracks} table.
 *
 * <p>Used for the promotion target, whose schema is owned and migrated by that
 * environment's own deployment. Every statement carries a query timeout.</p>
 */
@Slf4j
public class JdbcTrackStore implements TrackStore {

    private static final String COLUMNS = "id, created_date, title, artist, album, genre, description, tags, "
            + "filename, file_url, file_size, file_hash, format, duration, bitrate, sample_rate, channels, "
            + "status, thumbnail_url, enriched_date, promotion_date, promoted_from";

    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM tracks WHERE id = :id";

    private static final String SELECT_BY_STATUS = "SELECT " + COLUMNS
            + " FROM tracks WHERE status IN (:statuses) ORDER BY created_date ASC";

    private static final String UPDATE = "UPDATE tracks SET title = :title, artist = :artist, album = :album, "
            + "genre = :genre, description = :description, tags = :tags, filename = :filename, "
            + "file_url = :fileUrl, file_size = :fileSize, file_hash = :fileHash, format = :format, "
            + "duration = :duration, bitrate = :bitrate, sample_rate = :sampleRate, channels = :channels, "
            + "status = :status, thumbnail_url = :thumbnailUrl, enriched_date = :enrichedDate, "
            + "promotion_date = :promotionDate, promoted_from = :promotedFrom "
            + "WHERE id = :id AND created_date = :createdDate";

    private static final String UPDATE_IF_STATUS = UPDATE + " AND status IN (:expected)";

    private static final String INSERT = "INSERT INTO tracks (" + COLUMNS + ") VALUES (:id, :createdDate, "
            + ":title, :artist, :album, :genre, :description, :tags, :filename, :fileUrl, :fileSize, :fileHash, "
            + ":format, :duration, :bitrate, :sampleRate, :channels, :status, :thumbnailUrl, :enrichedDate, "
            + ":promotionDate, :promotedFrom)";

    private static final String DELETE = "DELETE FROM tracks WHERE id = :id";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTrackStore(DataSource dataSource, Duration queryTimeout) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        this.jdbc = new NamedParameterJdbcTemplate(template);
    }

    @Override
    public Optional<TrackRecord> findById(String id) {
        return jdbc.query(SELECT_BY_ID, new MapSqlParameterSource("id", id), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public List<TrackRecord> findByStatusIn(Collection<TrackStatus> statuses) {
        List<String> values = statuses.stream().map(TrackStatus::value).collect(Collectors.toList());
        return jdbc.query(SELECT_BY_STATUS, new MapSqlParameterSource("statuses", values), ROW_MAPPER);
    }

    @Override
    public TrackRecord save(TrackRecord record) {
        MapSqlParameterSource params = toParams(record);
        int updated = jdbc.update(UPDATE, params);
        if (updated == 0) {
            jdbc.update(INSERT, params);
            log.debug("Inserted track {} into target store", record.getId());
        } else {
            log.debug("Overwrote track {} in target store", record.getId());
        }
        return record;
    }

    @Override
    public boolean saveIfStatusIn(TrackRecord record, Collection<TrackStatus> expected) {
        List<String> values = expected.stream().map(TrackStatus::value).collect(Collectors.toList());
        MapSqlParameterSource params = toParams(record).addValue("expected", values);
        return jdbc.update(UPDATE_IF_STATUS, params) > 0;
    }

    @Override
    public boolean deleteById(String id) {
        return jdbc.update(DELETE, new MapSqlParameterSource("id", id)) > 0;
    }

    private MapSqlParameterSource toParams(TrackRecord record) {
        return new MapSqlParameterSource()
                .addValue("id", record.getId())
                .addValue("createdDate", toTimestamp(record.getCreatedDate()))
                .addValue("title", record.getTitle())
                .addValue("artist", record.getArtist())
                .addValue("album", record.getAlbum())
                .addValue("genre", record.getGenre() == null ? TrackRecord.UNKNOWN_GENRE : record.getGenre())
                .addValue("description", record.getDescription())
                .addValue("tags", TagListConverter.join(record.getTags()))
                .addValue("filename", record.getFilename())
                .addValue("fileUrl", record.getFileUrl())
                .addValue("fileSize", record.fileSizeOrZero())
                .addValue("fileHash", record.getFileHash())
                .addValue("format", record.getFormat())
                .addValue("duration", record.durationOrZero())
                .addValue("bitrate", record.getBitrate())
                .addValue("sampleRate", record.getSampleRate())
                .addValue("channels", record.getChannels())
                .addValue("status", record.getStatus().value())
                .addValue("thumbnailUrl", record.getThumbnailUrl())
                .addValue("enrichedDate", toTimestamp(record.getEnrichedDate()))
                .addValue("promotionDate", toTimestamp(record.getPromotionDate()))
                .addValue("promotedFrom", record.getPromotedFrom());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static final RowMapper<TrackRecord> ROW_MAPPER = (rs, rowNum) -> TrackRecord.builder()
            .id(rs.getString("id"))
            .createdDate(toInstant(rs, "created_date"))
            .title(rs.getString("title"))
            .artist(rs.getString("artist"))
            .album(rs.getString("album"))
            .genre(rs.getString("genre"))
            .description(rs.getString("description"))
            .tags(TagListConverter.split(rs.getString("tags")))
            .filename(rs.getString("filename"))
            .fileUrl(rs.getString("file_url"))
            .fileSize(rs.getLong("file_size"))
            .fileHash(rs.getString("file_hash"))
            .format(rs.getString("format"))
            .duration(rs.getInt("duration"))
            .bitrate(nullableInt(rs, "bitrate"))
            .sampleRate(nullableInt(rs, "sample_rate"))
            .channels(nullableInt(rs, "channels"))
            .status(TrackStatus.fromValue(rs.getString("status")))
            .thumbnailUrl(rs.getString("thumbnail_url"))
            .enrichedDate(toInstant(rs, "enriched_date"))
            .promotionDate(toInstant(rs, "promotion_date"))
            .promotedFrom(rs.getString("promoted_from"))
            .build();
}
