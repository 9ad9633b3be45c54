package com.spreadbook.api.dto.request;

import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Export files to pair into spread orders without touching the position store. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpreadPreviewRequest {

    @Valid
    @Builder.Default
    private List<TransactionSourceRequest> sources = new ArrayList<>();
}
