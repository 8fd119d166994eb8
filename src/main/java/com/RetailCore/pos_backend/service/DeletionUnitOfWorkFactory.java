package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.repository.DeletionRecordRepository;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.PurchaseOrderRepository;
import com.RetailCore.pos_backend.repository.SaleRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeletionUnitOfWorkFactory {

    private final ProductRepository productRepository;
    private final StockAdjustmentRepository stockAdjustmentRepository;
    private final NotificationRepository notificationRepository;
    private final SaleRepository saleRepository;
    private final PurchaseOrderRepository purchaseOrderRepository;
    private final DeletionRecordRepository deletionRecordRepository;

    public DeletionUnitOfWork begin(String workspaceId) {
        return new DeletionUnitOfWork(workspaceId,
                productRepository,
                stockAdjustmentRepository,
                notificationRepository,
                saleRepository,
                purchaseOrderRepository,
                deletionRecordRepository);
    }
}
