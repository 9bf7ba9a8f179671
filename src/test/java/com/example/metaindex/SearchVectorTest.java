package com.example.metaindex;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SearchVectorTest {

    @Test
    public void tokenizesEveryStringValueLowerCased() {
        ObjectNode doc = CanonicalJson.readObject("{\"name\":\"Foo-Bar\",\"author\":[\"Jane Doe\",\"John\"],\"version\":\"1.2\"}");
        SearchVector v = SearchVector.of(doc);
        assertThat(v.terms()).containsExactlyInAnyOrder("foo", "bar", "jane", "doe", "john", "1", "2");
    }

    @Test
    public void keepsWordsAStopwordListWouldDrop() {
        SearchVector v = SearchVector.of(CanonicalJson.readObject("{\"description\":\"The tool is a parser of the web\"}"));
        assertThat(v.contains("the")).isTrue();
        assertThat(v.contains("of")).isTrue();
    }

    @Test
    public void storedFormParsesBack() {
        SearchVector v = SearchVector.of(CanonicalJson.readObject("{\"a\":\"x y x\"}"));
        assertThat(v.toStoredForm()).isEqualTo(" x:2 y:1 ");
        assertThat(SearchVector.parse(v.toStoredForm())).isEqualTo(v);
        assertThat(v.toStoredForm()).contains(SearchVector.needle("x"));
    }

    @Test
    public void matchesRequiresEveryTerm() {
        SearchVector v = SearchVector.of(CanonicalJson.readObject("{\"name\":\"Foo\",\"author\":\"Jane Doe\"}"));
        assertThat(v.matchesAll(List.of("jane", "foo"))).isTrue();
        assertThat(v.matchesAll(List.of("jane", "smith"))).isFalse();
        assertThat(v.matchesAll(List.of())).isFalse();
    }

    @Test
    public void shorterDocumentsRankHigherForTheSameHits() {
        SearchVector shortDoc = SearchVector.of(CanonicalJson.readObject("{\"name\":\"parser\"}"));
        SearchVector longDoc = SearchVector.of(CanonicalJson.readObject(
                "{\"name\":\"parser\",\"description\":\"a very long description that goes on and on about many things\"}"));
        assertThat(shortDoc.rank(List.of("parser"))).isGreaterThan(longDoc.rank(List.of("parser")));
        assertThat(shortDoc.rank(List.of("missing"))).isZero();
    }

    @Test
    public void emptyQueryHasNoTerms() {
        assertThat(SearchVector.tokenize("  ")).isEmpty();
        assertThat(SearchVector.tokenize(null)).isEmpty();
        assertThat(SearchVector.tokenize("--")).isEmpty();
    }

    @Test
    public void largeDocumentsKeepNameAuthorAndKeywordTerms() {
        StringBuilder description = new StringBuilder();
        for (int i = 0; i < SearchVector.MAX_TERMS + 1000; i++) description.append("w").append(i).append(' ');
        ObjectNode doc = JsonNodeFactory.instance.objectNode();
        doc.put("name", "zorglub");
        doc.put("author", "Zygmunt Zed");
        doc.putArray("keywords").add("zzz-parser");
        doc.put("description", description.toString() + "w1 w2");

        SearchVector v = SearchVector.of(doc);

        assertThat(v.terms()).hasSize(SearchVector.MAX_TERMS);
        assertThat(v.contains("zorglub")).isTrue();
        assertThat(v.contains("zygmunt")).isTrue();
        assertThat(v.contains("zed")).isTrue();
        assertThat(v.contains("parser")).isTrue();
        // repeated description terms outlive single occurrences
        assertThat(v.contains("w1")).isTrue();
        assertThat(v.contains("w2")).isTrue();
        assertThat(SearchVector.parse(v.toStoredForm())).isEqualTo(v);
    }

    @Test
    public void numbersAndBooleansAreTokenizedToo() {
        SearchVector v = SearchVector.of(CanonicalJson.readObject("{\"name\":\"tool\",\"version\":2,\"x\":{\"y\":[3.5,true,null]}}"));
        assertThat(v.terms()).containsExactlyInAnyOrder("tool", "2", "3", "5", "true");
    }
}
