package com.capstone.drivesync.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveItemCollection(
        List<DriveItem> value,
        @JsonProperty("@odata.nextLink") String nextLink
) {
}
