package io.flakeedit.core.edit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flakeedit.core.model.Entry;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class EntryListingTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String FLAKE = """
            {
              inputs = {
                nixpkgs.url = "github:nixos/nixpkgs";
                crane = {
                  url = "github:ipetkov/crane";
                  inputs.nixpkgs.follows = "nixpkgs";
                };
              };
              outputs = { self, nixpkgs, crane }: { };
            }
            """;

    private static Map<String, Entry> entries;

    @BeforeAll
    static void listEntries() {
        entries = FlakeEdit.fromText(FLAKE).list();
    }

    @Test
    void simpleListsAliasesUnderTheirEntry() {
        assertThat(EntryListing.render(entries, EntryListing.Format.SIMPLE))
                .isEqualTo("crane\ncrane.nixpkgs\nnixpkgs");
    }

    @Test
    void toplevelListsIdsOnly() {
        assertThat(EntryListing.render(entries, EntryListing.Format.TOPLEVEL)).isEqualTo("crane\nnixpkgs");
    }

    @Test
    void detailedShowsUrlsAndTargets() {
        assertThat(EntryListing.render(entries, EntryListing.Format.DETAILED))
                .isEqualTo("· crane - \"github:ipetkov/crane\"\n"
                        + "     nixpkgs => \"nixpkgs\"\n"
                        + "· nixpkgs - \"github:nixos/nixpkgs\"");
    }

    @Test
    void jsonIsKeyedById() throws Exception {
        JsonNode json = MAPPER.readTree(EntryListing.render(entries, EntryListing.Format.JSON));

        assertThat(json.fieldNames()).toIterable().containsExactly("crane", "nixpkgs");
        JsonNode crane = json.get("crane");
        assertThat(crane.get("url").asText()).isEqualTo("\"github:ipetkov/crane\"");
        assertThat(crane.get("flake").asBoolean()).isTrue();
        assertThat(crane.get("follows").get(0).get("from").asText()).isEqualTo("nixpkgs");
        assertThat(crane.get("follows").get(0).get("target").asText()).isEqualTo("\"nixpkgs\"");

        JsonNode range = json.get("nixpkgs").get("range");
        assertThat(FLAKE.substring(range.get("start").asInt(), range.get("end").asInt()))
                .isEqualTo("\"github:nixos/nixpkgs\"");
    }

    @Test
    void emptyRegistryRendersEmpty() {
        assertThat(EntryListing.render(Map.of(), EntryListing.Format.SIMPLE)).isEmpty();
        assertThat(EntryListing.render(Map.of(), EntryListing.Format.JSON)).isEqualTo("{}");
    }
}
