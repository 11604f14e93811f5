/*
 * Where: Notification data access
 * What: Resolves kiln names and the owners of batches and pieces in a firing
 * Why: Kiln-unload notifications go to every member whose work was in the kiln
 */
package com.monsoonfire.notification.repository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class FiringOwnershipRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findKilnName(String kilnId) {
    final String sql = "SELECT name FROM kilns WHERE kiln_id = :kilnId";
    final List<String> names =
        jdbcTemplate.queryForList(sql, new MapSqlParameterSource("kilnId", kilnId), String.class);
    return names.stream().filter(name -> name != null && !name.isBlank()).findFirst();
  }

  /** batch id to owner uid, for batches with an owner. */
  public Map<String, String> findBatchOwners(Collection<String> batchIds) {
    if (batchIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT batch_id, owner_uid
        FROM batches
        WHERE batch_id IN (:batchIds)
          AND owner_uid <> ''
        ORDER BY batch_id
        """;
    final Map<String, String> result = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("batchIds", batchIds),
        rs -> {
          result.put(rs.getString("batch_id"), rs.getString("owner_uid"));
        });
    return result;
  }

  /** piece id to batch id, for pieces that belong to a batch. */
  public Map<String, String> findBatchIdsForPieces(Collection<String> pieceIds) {
    if (pieceIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        "SELECT piece_id, batch_id FROM batch_pieces WHERE piece_id IN (:pieceIds)";
    final Map<String, String> result = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("pieceIds", pieceIds),
        rs -> {
          result.put(rs.getString("piece_id"), rs.getString("batch_id"));
        });
    return result;
  }
}
