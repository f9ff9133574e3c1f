package com.example.berry.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ButtonRequest {

    /**
     * play_pause | next | prev | volume
     */
    @NotBlank
    private String button;
}
