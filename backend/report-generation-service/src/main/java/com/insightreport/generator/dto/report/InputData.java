package com.insightreport.generator.dto.report;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One block of report input, either tabular or free text.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = StructuredInput.class, name = "structured"),
        @JsonSubTypes.Type(value = UnstructuredInput.class, name = "unstructured")
})
public interface InputData {

    String getType();
}
