// services/recommender/src/main/java/dev/devanks/recommender/repository/DistrictRepository.java
package dev.devanks.recommender.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.recommender.config.RecommenderProperties;
import dev.devanks.recommender.model.District;
import dev.devanks.recommender.model.GeoData;
import dev.devanks.recommender.model.RawDistrict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory, read-only store of the tracked districts. Loaded once when the application starts.
 */
@Repository
@Slf4j
public class DistrictRepository {

    private final List<District> districts;
    private final Map<String, District> districtsByName;

    @Autowired
    public DistrictRepository(RecommenderProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this(load(resourceLoader.getResource(properties.getDistrictsResource()), objectMapper));
    }

    @VisibleForTesting
    public DistrictRepository(List<District> districts) {
        this.districts = List.copyOf(districts);
        this.districtsByName = indexByName(this.districts);
        log.info("Loaded {} districts.", this.districts.size());
    }

    public List<District> findAll() {
        return districts;
    }

    /**
     * Exact, case-sensitive lookup by display name.
     */
    public Optional<District> findByName(String name) {
        return Optional.ofNullable(name).map(districtsByName::get);
    }

    public int count() {
        return districts.size();
    }

    @VisibleForTesting
    static List<District> load(Resource resource, ObjectMapper objectMapper) {
        log.info("Reading districts from {}", resource.getDescription());
        try (InputStream in = resource.getInputStream()) {
            GeoData geoData = objectMapper.readValue(in, GeoData.class);
            return toDistricts(geoData);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load districts from " + resource.getDescription(), e);
        }
    }

    @VisibleForTesting
    static List<District> toDistricts(GeoData geoData) {
        List<District> parsed = new ArrayList<>();
        if (geoData == null || geoData.getDistricts() == null) {
            return parsed;
        }
        for (RawDistrict raw : geoData.getDistricts()) {
            if (raw.getId() == null || raw.getName() == null || raw.getLat() == null || raw.getLon() == null) {
                log.warn("Skipping incomplete district entry: {}", raw);
                continue;
            }
            try {
                parsed.add(District.builder()
                        .id(raw.getId())
                        .divisionId(raw.getDivisionId())
                        .name(raw.getName())
                        .bnName(raw.getBnName())
                        .lat(Double.parseDouble(raw.getLat()))
                        .lon(Double.parseDouble(raw.getLon()))
                        .build());
            } catch (NumberFormatException e) {
                log.warn("Skipping district {} ({}): invalid coordinates lat={}, long={}",
                        raw.getId(), raw.getName(), raw.getLat(), raw.getLon());
            }
        }
        return parsed;
    }

    private static Map<String, District> indexByName(List<District> districts) {
        Map<String, District> byName = new LinkedHashMap<>();
        for (District district : districts) {
            District previous = byName.putIfAbsent(district.getName(), district);
            if (previous != null) {
                throw new IllegalStateException("Duplicate district name '" + district.getName()
                        + "' (ids " + previous.getId() + " and " + district.getId() + ")");
            }
        }
        return Map.copyOf(byName);
    }
}
