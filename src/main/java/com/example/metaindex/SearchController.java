package com.example.metaindex;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/search")
public class SearchController {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SearchController.class);

    @Autowired
    private OriginIntrinsicMetadataFactStore intrinsicFacts;

    @Autowired
    private OriginExtrinsicMetadataFactStore extrinsicFacts;

    @Autowired
    private CtagsFactStore ctagsFacts;

    @Autowired
    private org.springframework.core.env.Environment env;

    /**
     * Origins whose metadata matches every term of {@code q}, best match first.
     */
    @GetMapping("/origins")
    public List<ApiModels.OriginHit> searchOrigins(@RequestParam(name = "q") String q,
                                                   @RequestParam(name = "limit", required = false) Integer limit,
                                                   @RequestParam(name = "source", defaultValue = "intrinsic") String source) {
        int max = limit != null ? limit : Integer.parseInt(env.getProperty("indexer.search.default-limit", "10"));
        log.info("full-text origin search q='{}' source={} limit={}", q, source, max);
        List<ApiModels.OriginHit> out = new ArrayList<>();
        for (Fact<OriginMetadata> f : facts(source).searchFulltext(q, max)) out.add(ApiModels.OriginHit.of(f));
        return out;
    }

    @GetMapping("/origins/by-producer")
    public ApiModels.ProducerPageView byProducer(@RequestParam(name = "mappings", required = false) List<String> mappings,
                                                 @RequestParam(name = "toolIds", required = false) List<Long> toolIds,
                                                 @RequestParam(name = "pageToken", required = false) String pageToken,
                                                 @RequestParam(name = "limit", defaultValue = "50") int limit,
                                                 @RequestParam(name = "idsOnly", defaultValue = "false") boolean idsOnly,
                                                 @RequestParam(name = "source", defaultValue = "intrinsic") String source) {
        OriginMetadataFactStore.ProducerPage page = facts(source).searchByProducer(mappings, toolIds, pageToken, limit);
        if (idsOnly) return new ApiModels.ProducerPageView(null, page.originIds(), page.nextPageToken());
        List<ApiModels.OriginHit> hits = new ArrayList<>();
        for (Fact<OriginMetadata> f : page.origins()) hits.add(ApiModels.OriginHit.of(f));
        return new ApiModels.ProducerPageView(hits, page.originIds(), page.nextPageToken());
    }

    @GetMapping("/origins/stats")
    public OriginMetadataFactStore.MetadataStats stats(@RequestParam(name = "source", defaultValue = "intrinsic") String source) {
        return facts(source).stats();
    }

    @GetMapping("/ctags")
    public List<ApiModels.FactView> ctags(@RequestParam(name = "name") String name,
                                          @RequestParam(name = "limit", defaultValue = "10") int limit) {
        List<ApiModels.FactView> out = new ArrayList<>();
        for (Fact<List<CtagsSymbol>> f : ctagsFacts.searchSymbol(name, limit)) out.add(ApiModels.FactView.of(f));
        return out;
    }

    private OriginMetadataFactStore<?> facts(String source) {
        switch (source) {
            case "intrinsic":
                return intrinsicFacts;
            case "extrinsic":
                return extrinsicFacts;
            default:
                throw new IllegalArgumentException("source must be intrinsic or extrinsic, not " + source);
        }
    }
}
