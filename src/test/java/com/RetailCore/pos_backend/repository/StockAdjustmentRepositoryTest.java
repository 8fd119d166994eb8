package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.model.StockAdjustment;
import com.RetailCore.pos_backend.util.LedgerReasons;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class StockAdjustmentRepositoryTest {

    private static final String WORKSPACE = "ws-ledger";

    @Autowired
    private StockAdjustmentRepository stockAdjustmentRepository;

    private StockAdjustment save(String workspaceId, String reason, AdjustmentSource sourceType, UUID sourceId) {
        return stockAdjustmentRepository.save(StockAdjustment.builder()
                .workspaceId(workspaceId)
                .productId(UUID.randomUUID())
                .quantity(-1)
                .previousStock(5)
                .newStock(4)
                .reason(reason)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .performedByName("tester")
                .build());
    }

    @Test
    void findOwnedBySource_ShouldMatchStructuredAndLegacyRows() {
        UUID saleId = UUID.randomUUID();
        String publicId = "TRX-7K3MQ9ZD";

        StockAdjustment structured = save(WORKSPACE, LedgerReasons.forSale(publicId), AdjustmentSource.SALE, saleId);
        StockAdjustment legacyByPublicId = save(WORKSPACE, "Sale #" + publicId, null, null);
        StockAdjustment legacyByInternalId = save(WORKSPACE, "Sale #" + saleId, null, null);
        save(WORKSPACE, "Sale #TRX-OTHER000", AdjustmentSource.SALE, UUID.randomUUID());
        save(WORKSPACE, "Counted shelf", AdjustmentSource.MANUAL, null);
        save("ws-elsewhere", "Sale #" + publicId, null, null);

        List<StockAdjustment> owned = stockAdjustmentRepository.findOwnedBySource(WORKSPACE, AdjustmentSource.SALE,
                saleId, LedgerReasons.legacySaleReasons(saleId, publicId));

        Set<UUID> ids = owned.stream().map(StockAdjustment::getId).collect(Collectors.toSet());
        assertEquals(Set.of(structured.getId(), legacyByPublicId.getId(), legacyByInternalId.getId()), ids);
    }

    @Test
    void findOwnedBySource_ShouldIgnoreTaggedRowsOfOtherTransactionsWithSameReason() {
        UUID saleId = UUID.randomUUID();
        String publicId = "TRX-DUPL1CAT";
        save(WORKSPACE, "Sale #" + publicId, AdjustmentSource.SALE, UUID.randomUUID());

        List<StockAdjustment> owned = stockAdjustmentRepository.findOwnedBySource(WORKSPACE, AdjustmentSource.SALE,
                saleId, LedgerReasons.legacySaleReasons(saleId, publicId));

        assertTrue(owned.isEmpty());
    }

    @Test
    void findByWorkspaceIdAndProductId_ShouldListNewestFirst() throws InterruptedException {
        UUID productId = UUID.randomUUID();
        StockAdjustment first = stockAdjustmentRepository.save(StockAdjustment.builder()
                .workspaceId(WORKSPACE).productId(productId).quantity(5).previousStock(0).newStock(5)
                .reason(LedgerReasons.STOCK_RECEIVED).sourceType(AdjustmentSource.STOCK_RECEIVED).build());
        Thread.sleep(5);
        StockAdjustment second = stockAdjustmentRepository.save(StockAdjustment.builder()
                .workspaceId(WORKSPACE).productId(productId).quantity(-2).previousStock(5).newStock(3)
                .reason("Damaged").sourceType(AdjustmentSource.MANUAL).build());

        List<StockAdjustment> history = stockAdjustmentRepository.findByWorkspaceIdAndProductIdOrderByCreatedAtDesc(WORKSPACE, productId);

        assertEquals(List.of(second.getId(), first.getId()),
                history.stream().map(StockAdjustment::getId).collect(Collectors.toList()));
    }
}
