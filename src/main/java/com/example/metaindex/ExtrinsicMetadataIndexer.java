package com.example.metaindex;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Origin-extrinsic path: raw metadata records published about an origin by its forge or a
 * package repository are translated and stored as origin extrinsic facts.
 */
@Slf4j
@Service
public class ExtrinsicMetadataIndexer {

    private final ContentMetadataTranslator translator;
    private final OriginMetadataAggregator aggregator;
    private final PipelineTools tools;

    public ExtrinsicMetadataIndexer(ContentMetadataTranslator translator, OriginMetadataAggregator aggregator, PipelineTools tools) {
        this.translator = translator;
        this.aggregator = aggregator;
        this.tools = tools;
    }

    public List<OriginMetadata> indexAll(List<RawExtrinsicMetadata> records) {
        List<OriginMetadata> out = new ArrayList<>();
        for (RawExtrinsicMetadata r : records) index(r).ifPresent(out::add);
        return out;
    }

    public Optional<OriginMetadata> index(RawExtrinsicMetadata record) {
        if (record.target() == null || !record.target().contains("://")) {
            log.debug("skipping extrinsic metadata {}: target {} is not an origin", record.id(), record.target());
            return Optional.empty();
        }
        if (!aggregator.authorityMatches(record.target(), record.authority())) {
            log.info("dropping extrinsic metadata {}: authority {} does not match origin {}", record.id(),
                    record.authority() == null ? null : record.authority().url(), record.target());
            return Optional.empty();
        }
        Long toolId = tools.extrinsic().getId();
        Ecosystem eco;
        ObjectNode doc;
        try {
            eco = Ecosystem.byDeclaredFormat(record.format());
            doc = translator.translate(record.metadata(), eco);
        } catch (MetadataParseException | UnsupportedFormatException e) {
            log.warn("stage=extrinsic object={} tool={}: {}", record.id(), toolId, e.getMessage());
            return Optional.empty();
        }
        List<String> mappings = doc.isEmpty() ? List.of() : List.of(eco.tag());
        return aggregator.aggregateExtrinsic(record.target(), record.id(), doc, mappings, record.authority(), toolId);
    }
}
