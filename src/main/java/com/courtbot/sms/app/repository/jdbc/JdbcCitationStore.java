package com.courtbot.sms.app.repository.jdbc;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.repository.CitationStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/** Citation store over the {@code cases} table. */
@Log4j2
@Repository
public class JdbcCitationStore implements CitationStore {

  private static final String COLUMNS =
      "id, citation, defendant, court_date, court_time, room, court_type";

  static final RowMapper<CaseRecord> CASE_ROW_MAPPER = JdbcCitationStore::mapCase;

  private final JdbcTemplate jdbcTemplate;

  public JdbcCitationStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
  }

  @Override
  public List<CaseRecord> findExact(String citationText) {
    if (citationText == null || citationText.isBlank()) return List.of();
    try {
      List<CaseRecord> rows =
          jdbcTemplate.query(
              "SELECT " + COLUMNS + " FROM cases WHERE citation = ?", CASE_ROW_MAPPER, citationText);
      log.debug("citations.findExact citation={} hits={}", citationText, rows.size());
      return rows;
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Citation lookup failed for " + citationText, e);
    }
  }

  @Override
  public List<CaseRecord> findFuzzy(String queryText) {
    if (queryText == null || queryText.isBlank()) return List.of();
    String q = queryText.trim();
    String pattern = "%" + escapeLike(q.toUpperCase(Locale.ROOT)) + "%";
    try {
      return jdbcTemplate.query(
          "SELECT "
              + COLUMNS
              + " FROM cases WHERE UPPER(defendant) LIKE ? ESCAPE '\\' OR citation = ?"
              + " ORDER BY court_date, defendant",
          CASE_ROW_MAPPER,
          pattern,
          q.toUpperCase(Locale.ROOT));
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Fuzzy case search failed", e);
    }
  }

  private static CaseRecord mapCase(ResultSet rs, int rowNum) throws SQLException {
    return CaseRecord.builder()
        .id(rs.getString("id"))
        .citation(rs.getString("citation"))
        .defendant(rs.getString("defendant"))
        .date(rs.getObject("court_date", LocalDate.class))
        .time(rs.getString("court_time"))
        .room(rs.getString("room"))
        .courtType(rs.getString("court_type"))
        .build();
  }

  private static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
