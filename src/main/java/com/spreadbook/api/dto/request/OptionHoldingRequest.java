package com.spreadbook.api.dto.request;

import com.spreadbook.domain.enums.OptionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptionHoldingRequest {

    @NotBlank
    private String ticker;

    @NotNull
    private LocalDate expiration;

    @NotNull
    private BigDecimal strike;

    @NotNull
    private OptionType optionType;

    /** Signed: negative = short. */
    private int quantity;

    private BigDecimal pricePaid;
}
