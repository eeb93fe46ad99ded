package dev.devanks.solarprofile.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SitePage {

    public static final int UNKNOWN_TOTAL = -1;

    int offset;
    List<JsonNode> records; // raw, mapped one by one so a bad record cannot fail the page
    int totalCount;
    String decodedBy;

    public boolean isTotalKnown() {
        return totalCount >= 0;
    }
}
