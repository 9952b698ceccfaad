package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OdataId(@JsonProperty("@odata.id") String id) {}
