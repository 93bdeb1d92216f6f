package com.printshop_voice_backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ControlMessage {
    private ControlType type;
    private JsonNode data; // Optional, currently unused by any command
}
