package com.apidocs.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code name: description} entry of a detail section. The description keeps
 * everything after the colon verbatim, continuation lines and trailing blank lines included.
 */
@Value
public class DetailItem {
    @NonNull
    String name;
    @NonNull
    String description;
}
