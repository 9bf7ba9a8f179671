package com.example.metaindex;

import jakarta.persistence.*;

@Entity
@IdClass(FactKey.class)
@Table(name = "content_ctags")
public class ContentCtagsRecord implements FactRecord {

    @Id
    @Column(name = "id", length = 64)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    // JSON array of {name, kind, line, lang}
    @Lob
    @Column(name = "symbols", columnDefinition = "CLOB")
    private String symbols;

    // " name1 name2 " for exact symbol lookups
    @Column(name = "symbol_index", length = 1000000)
    private String symbolIndex;

    public ContentCtagsRecord() {}

    public ContentCtagsRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    public String getSymbols() { return symbols; }
    public void setSymbols(String symbols) { this.symbols = symbols; }
    public String getSymbolIndex() { return symbolIndex; }
    public void setSymbolIndex(String symbolIndex) { this.symbolIndex = symbolIndex; }
}
