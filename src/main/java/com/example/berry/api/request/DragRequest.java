package com.example.berry.api.request;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import lombok.Data;

@Data
public class DragRequest {

    /**
     * start | end
     */
    @NotBlank
    @Pattern(regexp = "(?i)start|end")
    private String phase;

    /**
     * Index the carousel lands on; required when the drag ends.
     */
    @Min(0)
    private Integer targetIndex;
}
