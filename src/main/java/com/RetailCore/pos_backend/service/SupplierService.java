package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.SupplierRequest;
import com.RetailCore.pos_backend.dto.response.SupplierResponse;
import com.RetailCore.pos_backend.exception.ResourceNotFoundException;
import com.RetailCore.pos_backend.exception.ValidationException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.Supplier;
import com.RetailCore.pos_backend.repository.SupplierRepository;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import com.RetailCore.pos_backend.util.PublicIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SupplierService {

    private static final String SUPPLIER_PREFIX = "SUP-";

    private final SupplierRepository supplierRepository;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<SupplierResponse> getSuppliers(boolean activeOnly) {
        String workspaceId = workspaceContext.getWorkspaceId();
        List<Supplier> suppliers = activeOnly
                ? supplierRepository.findByWorkspaceIdAndActiveTrueOrderByNameAsc(workspaceId)
                : supplierRepository.findByWorkspaceIdOrderByNameAsc(workspaceId);
        return suppliers.stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SupplierResponse getSupplier(UUID id) {
        return mapToResponse(findOwnedSupplier(id));
    }

    @Transactional
    public SupplierResponse createSupplier(SupplierRequest request) {
        String workspaceId = workspaceContext.getWorkspaceId();
        if (supplierRepository.existsByWorkspaceIdAndNameIgnoreCase(workspaceId, request.getName())) {
            throw new ValidationException("A supplier with this name already exists.");
        }

        Supplier supplier = Supplier.builder()
                .workspaceId(workspaceId)
                .publicId(PublicIdGenerator.generateUnique(SUPPLIER_PREFIX,
                        inventoryProperties.getSupplierIdLength(), supplierRepository::existsByPublicId))
                .name(request.getName())
                .contactPerson(request.getContactPerson())
                .email(request.getEmail())
                .phone(request.getPhone())
                .address(request.getAddress())
                .active(true)
                .build();

        Supplier saved = supplierRepository.save(supplier);
        log.info("Supplier created: {} ({})", saved.getName(), saved.getPublicId());
        return mapToResponse(saved);
    }

    @Transactional
    public SupplierResponse updateSupplier(UUID id, SupplierRequest request) {
        Supplier supplier = findOwnedSupplier(id);

        if (supplierRepository.existsByWorkspaceIdAndNameIgnoreCaseAndIdNot(
                supplier.getWorkspaceId(), request.getName(), supplier.getId())) {
            throw new ValidationException("A supplier with this name already exists.");
        }

        supplier.setName(request.getName());
        supplier.setContactPerson(request.getContactPerson());
        supplier.setEmail(request.getEmail());
        supplier.setPhone(request.getPhone());
        supplier.setAddress(request.getAddress());

        Supplier updated = supplierRepository.save(supplier);
        log.info("Supplier updated: {}", updated.getName());
        return mapToResponse(updated);
    }

    /**
     * Deactivates the supplier. Purchase orders keep their supplier name and id.
     */
    @Transactional
    public void deactivateSupplier(UUID id) {
        Supplier supplier = findOwnedSupplier(id);
        supplier.setActive(false);
        supplierRepository.save(supplier);
        log.info("Supplier deactivated: {}", supplier.getName());
    }

    @Transactional
    public void activateSupplier(UUID id) {
        Supplier supplier = findOwnedSupplier(id);
        supplier.setActive(true);
        supplierRepository.save(supplier);
        log.info("Supplier activated: {}", supplier.getName());
    }

    /**
     * Supplier a new purchase order is placed with. Inactive suppliers take no new orders.
     */
    Supplier findOrderableSupplier(UUID id) {
        Supplier supplier = findOwnedSupplier(id);
        if (!supplier.isActive()) {
            throw new ValidationException("Supplier " + supplier.getName() + " is inactive.");
        }
        return supplier;
    }

    private Supplier findOwnedSupplier(UUID id) {
        Supplier supplier = supplierRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Supplier", "id", id));
        if (!workspaceContext.owns(supplier.getWorkspaceId())) {
            throw new WorkspaceAccessException("supplier");
        }
        return supplier;
    }

    private SupplierResponse mapToResponse(Supplier supplier) {
        return modelMapper.map(supplier, SupplierResponse.class);
    }
}
