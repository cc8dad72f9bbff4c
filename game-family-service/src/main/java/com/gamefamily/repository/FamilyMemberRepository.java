package com.gamefamily.repository;

import com.gamefamily.model.FamilyMember;
import com.gamefamily.tenant.TenantContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persistence for {@link FamilyMember}. Lookups are scoped to the tenant bound in {@link TenantContext};
 * every method joins the caller's transaction when one is active.
 */
@Repository
public class FamilyMemberRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<FamilyMember> MEMBER_MAPPER = (rs, rowNum) -> new FamilyMember(
        rs.getLong("id"),
        rs.getLong("character_id"),
        rs.getObject("tenant_id", UUID.class),
        rs.getObject("senior_id") != null ? rs.getLong("senior_id") : null,
        parseJuniorIds(rs.getString("junior_ids")),
        rs.getLong("rep"),
        rs.getInt("daily_rep"),
        rs.getInt("level"),
        rs.getInt("world"),
        rs.getInt("map_id"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    public FamilyMemberRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<FamilyMember> findByCharacterId(long characterId) {
        List<FamilyMember> results = jdbc.query(
            "SELECT * FROM family_member WHERE character_id = ? AND tenant_id = ?",
            MEMBER_MAPPER,
            characterId, TenantContext.require()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Same as {@link #findByCharacterId} but holds a row lock until the surrounding transaction ends.
     */
    public Optional<FamilyMember> findByCharacterIdForUpdate(long characterId) {
        List<FamilyMember> results = jdbc.query(
            "SELECT * FROM family_member WHERE character_id = ? AND tenant_id = ? FOR UPDATE",
            MEMBER_MAPPER,
            characterId, TenantContext.require()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<FamilyMember> findBySeniorId(long seniorId) {
        return jdbc.query(
            "SELECT * FROM family_member WHERE senior_id = ? AND tenant_id = ? ORDER BY character_id",
            MEMBER_MAPPER,
            seniorId, TenantContext.require()
        );
    }

    public boolean existsByCharacterId(long characterId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM family_member WHERE character_id = ? AND tenant_id = ?",
            Integer.class,
            characterId, TenantContext.require()
        );
        return count != null && count > 0;
    }

    /**
     * Insert when the member has no surrogate id yet, otherwise overwrite the stored row.
     *
     * @return the member as stored, including its generated id
     */
    public FamilyMember save(FamilyMember member) {
        if (member.id() == null) {
            jdbc.update("""
                INSERT INTO family_member (character_id, tenant_id, senior_id, junior_ids, rep, daily_rep,
                                           level, world, map_id, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                member.characterId(), member.tenantId(), member.seniorId(), formatJuniorIds(member.juniorIds()),
                member.rep(), member.dailyRep(), member.level(), member.world(), member.mapId(),
                Timestamp.from(member.createdAt()), Timestamp.from(member.updatedAt())
            );
        } else {
            jdbc.update("""
                UPDATE family_member
                SET senior_id = ?, junior_ids = ?, rep = ?, daily_rep = ?, level = ?, world = ?, map_id = ?,
                    updated_at = ?
                WHERE character_id = ? AND tenant_id = ?
                """,
                member.seniorId(), formatJuniorIds(member.juniorIds()), member.rep(), member.dailyRep(),
                member.level(), member.world(), member.mapId(), Timestamp.from(member.updatedAt()),
                member.characterId(), member.tenantId()
            );
        }
        return jdbc.queryForObject(
            "SELECT * FROM family_member WHERE character_id = ? AND tenant_id = ?",
            MEMBER_MAPPER,
            member.characterId(), member.tenantId()
        );
    }

    public boolean deleteByCharacterId(long characterId) {
        return jdbc.update(
            "DELETE FROM family_member WHERE character_id = ? AND tenant_id = ?",
            characterId, TenantContext.require()
        ) > 0;
    }

    /**
     * Zero the daily counter of every member, across all tenants, in a single statement.
     *
     * @return number of rows that had a non-zero daily counter
     */
    public int resetDailyRep(Instant resetTime) {
        return jdbc.update(
            "UPDATE family_member SET daily_rep = 0, updated_at = ? WHERE daily_rep > 0",
            Timestamp.from(resetTime)
        );
    }

    static List<Long> parseJuniorIds(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .map(Long::valueOf)
            .toList();
    }

    static String formatJuniorIds(List<Long> juniorIds) {
        return juniorIds.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(","));
    }
}
