package com.example.berry.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import lombok.Data;

@Data
public class SwipeRequest {

    /**
     * left | right
     */
    @NotBlank
    @Pattern(regexp = "(?i)left|right")
    private String direction;
}
