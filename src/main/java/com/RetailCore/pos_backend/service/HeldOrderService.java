package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.HoldOrderRequest;
import com.RetailCore.pos_backend.dto.response.HeldOrderResponse;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.model.HeldOrder;
import com.RetailCore.pos_backend.model.HeldOrderLine;
import com.RetailCore.pos_backend.repository.HeldOrderRepository;
import com.RetailCore.pos_backend.security.Actor;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import com.RetailCore.pos_backend.util.PublicIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Parks carts at the till. Resuming is done by the client: it posts the held lines
 * as a sale and then deletes the held order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeldOrderService {

    private static final String HELD_ORDER_PREFIX = "HLD-";

    private final HeldOrderRepository heldOrderRepository;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;
    private final ModelMapper modelMapper;

    @Transactional
    public HeldOrderResponse holdOrder(HoldOrderRequest request) {
        Actor actor = workspaceContext.getCurrentActor();

        HeldOrder heldOrder = HeldOrder.builder()
                .workspaceId(workspaceContext.getWorkspaceId())
                .publicId(PublicIdGenerator.generateUnique(HELD_ORDER_PREFIX,
                        inventoryProperties.getHeldOrderIdLength(), heldOrderRepository::existsByPublicId))
                .note(request.getNote())
                .heldById(actor.getId())
                .heldByName(actor.getName())
                .build();

        request.getItems().forEach(item -> heldOrder.getLines().add(HeldOrderLine.builder()
                .productId(item.getProductId())
                .variantId(item.getVariantId())
                .productName(item.getProductName())
                .sku(item.getSku())
                .variantLabel(item.getVariantLabel())
                .quantity(item.getQuantity())
                .costPrice(item.getCostPrice())
                .retailPrice(item.getRetailPrice())
                .build()));

        HeldOrder saved = heldOrderRepository.save(heldOrder);
        log.info("Order {} held by {} with {} lines", saved.getPublicId(), actor.getName(), saved.getLines().size());
        return mapToResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<HeldOrderResponse> getHeldOrders() {
        return heldOrderRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public OperationResult<Void> deleteHeldOrder(UUID id) {
        Optional<HeldOrder> found = heldOrderRepository.findById(id);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Held order not found.");
        }

        HeldOrder heldOrder = found.get();
        if (!workspaceContext.owns(heldOrder.getWorkspaceId())) {
            return OperationResult.failure(ErrorType.ACCESS_DENIED, "You do not have access to this held order.");
        }

        heldOrderRepository.delete(heldOrder);
        log.debug("Held order {} removed", heldOrder.getPublicId());
        return OperationResult.ok("Held order " + heldOrder.getPublicId() + " removed.");
    }

    private HeldOrderResponse mapToResponse(HeldOrder heldOrder) {
        return modelMapper.map(heldOrder, HeldOrderResponse.class);
    }
}
