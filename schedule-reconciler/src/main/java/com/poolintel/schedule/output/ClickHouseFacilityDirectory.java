package com.poolintel.schedule.output;

import com.poolintel.schedule.model.Facility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Facility directory backed by the curated {@code pool_intel.facilities} table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseFacilityDirectory implements FacilityDirectory {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Facility> snapshot() {
        List<Facility> facilities = jdbcTemplate.query("""
                SELECT facility_id, name, address, postal_code
                FROM pool_intel.facilities FINAL
                ORDER BY facility_id
                """,
                (rs, rowNum) -> Facility.builder()
                        .facilityId(rs.getString("facility_id"))
                        .name(rs.getString("name"))
                        .address(rs.getString("address"))
                        .postalCode(rs.getString("postal_code"))
                        .build());
        log.info("Loaded {} facilities from directory", facilities.size());
        return facilities;
    }
}
