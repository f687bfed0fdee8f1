package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;
import com.companya.trippipeline.model.TripRecordEntity;
import com.companya.trippipeline.model.TripRecordKey;
import com.companya.trippipeline.repository.TripRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

@Component
public class JpaTripRecordStore implements TripRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTripRecordStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ITEM_TYPE = new TypeReference<>() {
    };

    private final TripRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public JpaTripRecordStore(TripRecordRepository repository,
                              ObjectMapper objectMapper,
                              @Value("${pipeline.store.scan-page-size:100}") int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pipeline.store.scan-page-size must be positive");
        }
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.pageSize = pageSize;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TripRecord> getItem(String tableName, String id) {
        return repository.findById(new TripRecordKey(tableName, id)).map(this::toRecord);
    }

    @Override
    @Transactional
    public void putItem(String tableName, TripRecord record) {
        String attributes = writeAttributes(record);
        TripRecordEntity entity = repository.findById(new TripRecordKey(tableName, record.getId()))
                .map(existing -> {
                    existing.setAttributes(attributes);
                    return existing;
                })
                .orElseGet(() -> new TripRecordEntity(tableName, record.getId(), attributes));
        repository.save(entity);
        log.debug("Stored trip {} in table {}", record.getId(), tableName);
    }

    @Override
    @Transactional(readOnly = true)
    public ScanPage scan(String tableName, ScanFilter filter, String exclusiveStartToken) {
        Pageable page = PageRequest.ofSize(pageSize);
        List<TripRecordEntity> rows = exclusiveStartToken == null
                ? repository.findByTableNameOrderByIdAsc(tableName, page)
                : repository.findByTableNameAndIdGreaterThanOrderByIdAsc(tableName, exclusiveStartToken, page);

        List<TripRecord> matches = new ArrayList<>();
        for (TripRecordEntity row : rows) {
            TripRecord record = toRecord(row);
            if (filter.matches(record)) {
                matches.add(record);
            }
        }
        String nextToken = rows.size() < pageSize ? null : rows.get(rows.size() - 1).getId();
        log.debug("Scanned {} rows of table {} ({} matched), next token {}",
                rows.size(), tableName, matches.size(), nextToken);
        return new ScanPage(matches, nextToken);
    }

    private TripRecord toRecord(TripRecordEntity entity) {
        try {
            return new TripRecord(entity.getId(), objectMapper.readValue(entity.getAttributes(), ITEM_TYPE));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt attributes for trip " + entity.getId(), ex);
        }
    }

    private String writeAttributes(TripRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getItem());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Trip " + record.getId() + " is not serializable", ex);
        }
    }
}
