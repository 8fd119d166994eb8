package com.RetailCore.pos_backend.model;

import com.RetailCore.pos_backend.enums.PaymentType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalePayment {

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false)
    private PaymentType type;

    // Negative for money paid out on a return
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;
}
