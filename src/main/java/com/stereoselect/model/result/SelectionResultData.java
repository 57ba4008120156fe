package com.stereoselect.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of a selection run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectionResultData {

    private Integer count;

    @JsonProperty("anchors_processed")
    private Integer anchorsProcessed;

    @JsonProperty("anchors_skipped")
    private List<String> anchorsSkipped;

    private List<ResultRow> rows;

    /** Path the rows were exported to, when an export was requested */
    private String exported;

    public static SelectionResultData of(SelectionResult<?> result, String exported) {
        return SelectionResultData.builder()
                .count(result.getRows().size())
                .anchorsProcessed(result.getAnchorsProcessed())
                .anchorsSkipped(result.getSkippedAnchorIds())
                .rows(result.getRows())
                .exported(exported)
                .build();
    }
}
