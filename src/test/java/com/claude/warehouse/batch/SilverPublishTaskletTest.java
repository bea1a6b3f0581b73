package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.silver.SilverCustomerLocation;
import com.claude.warehouse.repository.silver.SilverCustomerLocationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SilverPublishTaskletTest {

    @Mock
    private SilverCustomerLocationRepository repository;

    private final SilverStagingArea stagingArea = new SilverStagingArea();

    @Test
    @DisplayName("Should replace the Silver table with the staged rows")
    void testPublish() throws Exception {
        SilverStagingWriter<SilverCustomerLocation> writer =
                new SilverStagingWriter<>(SilverEntity.ERP_CUST_LOCATION, stagingArea);
        writer.beforeStep(new StepExecution("erpCustLocationReconcileStep", null));
        writer.write(new Chunk<>(List.of(location("AW-1"), location("AW-2"))));
        writer.write(new Chunk<>(List.of(location("AW-3"))));

        SilverPublishTasklet<SilverCustomerLocation> tasklet = new SilverPublishTasklet<>(
                SilverEntity.ERP_CUST_LOCATION, SilverCustomerLocation.class, repository, stagingArea);
        StepContribution contribution = new StepContribution(new StepExecution("erpCustLocationPublishStep", null));

        RepeatStatus status = tasklet.execute(contribution, null);

        assertEquals(RepeatStatus.FINISHED, status);
        assertEquals(3, contribution.getWriteCount());

        InOrder inOrder = inOrder(repository);
        inOrder.verify(repository).deleteAllInBatch();
        inOrder.verify(repository).saveAll(argThat(rows -> ((List<?>) rows).size() == 3));
    }

    @Test
    @DisplayName("Should refuse to publish when nothing was staged")
    void testPublishWithoutStaging() {
        SilverPublishTasklet<SilverCustomerLocation> tasklet = new SilverPublishTasklet<>(
                SilverEntity.ERP_CUST_LOCATION, SilverCustomerLocation.class, repository, stagingArea);

        assertThrows(IllegalStateException.class, () -> tasklet.execute(
                new StepContribution(new StepExecution("erpCustLocationPublishStep", null)), null));
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Should start every run with an empty staging container")
    void testStagingReopenedPerRun() {
        stagingArea.open(SilverEntity.ERP_CUST_LOCATION);
        stagingArea.stage(SilverEntity.ERP_CUST_LOCATION, List.of(location("stale")));

        stagingArea.open(SilverEntity.ERP_CUST_LOCATION);

        assertEquals(0, stagingArea.stagedCount(SilverEntity.ERP_CUST_LOCATION));
        assertTrue(stagingArea.drain(SilverEntity.ERP_CUST_LOCATION, SilverCustomerLocation.class).isEmpty());
        assertThrows(IllegalStateException.class,
                () -> stagingArea.stage(SilverEntity.ERP_CUST_LOCATION, List.of(location("late"))));
    }

    private static SilverCustomerLocation location(String key) {
        return SilverCustomerLocation.builder()
                .customerKey(key)
                .country("Australia")
                .build();
    }
}
