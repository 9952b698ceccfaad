package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ManagerPatch(@JsonProperty("ServiceIdentification") String serviceIdentification) {}
