package com.RetailCore.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupplierResponse {
    private UUID id;
    private String publicId;
    private String name;
    private String contactPerson;
    private String email;
    private String phone;
    private String address;
    private boolean active;
    private LocalDateTime createdAt;
}
