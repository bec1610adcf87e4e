package com.customerapi.customer.repository;

import com.customerapi.common.exception.PersistenceException;
import com.customerapi.customer.model.Address;
import com.customerapi.customer.model.Customer;
import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CustomerRepositoryTest {

    @Mock
    private Firestore firestore;

    @Mock
    private CollectionReference customersCollection;

    @Mock
    private CollectionReference countersCollection;

    @Mock
    private DocumentReference counterDocument;

    @Mock
    private DocumentReference customerDocument;

    @Mock
    private Transaction transaction;

    @Mock
    private DocumentSnapshot counterSnapshot;

    private CustomerRepository repository;

    @BeforeEach
    void setUp() {
        repository = new CustomerRepository(firestore);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void create_ShouldAssignNextIdFromCounterInsideTransaction() {
        when(firestore.collection("counters")).thenReturn(countersCollection);
        when(countersCollection.document("customers")).thenReturn(counterDocument);
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("8")).thenReturn(customerDocument);
        when(transaction.get(counterDocument)).thenReturn(ApiFutures.immediateFuture(counterSnapshot));
        when(counterSnapshot.exists()).thenReturn(true);
        when(counterSnapshot.getLong("lastId")).thenReturn(7L);
        runTransactionCallbackThen(null);

        Customer created = repository.create(Customer.builder().fullName("Ada Lovelace").build());

        assertEquals(8, created.getId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> counterData = ArgumentCaptor.forClass(Map.class);
        verify(transaction).set(eq(counterDocument), counterData.capture());
        assertEquals(8L, counterData.getValue().get("lastId"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> customerData = ArgumentCaptor.forClass(Map.class);
        verify(transaction).set(eq(customerDocument), customerData.capture());
        assertEquals(8L, customerData.getValue().get("id"));
        assertEquals("Ada Lovelace", customerData.getValue().get("fullName"));
    }

    @Test
    void create_ShouldStartAtOneWhenCounterIsMissing() {
        when(firestore.collection("counters")).thenReturn(countersCollection);
        when(countersCollection.document("customers")).thenReturn(counterDocument);
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("1")).thenReturn(customerDocument);
        when(transaction.get(counterDocument)).thenReturn(ApiFutures.immediateFuture(counterSnapshot));
        when(counterSnapshot.exists()).thenReturn(false);
        runTransactionCallbackThen(null);

        assertEquals(1, repository.create(Customer.builder().fullName("Ada Lovelace").build()).getId());
    }

    @Test
    void create_ShouldClearIdWhenTransactionFails() {
        when(firestore.collection("counters")).thenReturn(countersCollection);
        when(countersCollection.document("customers")).thenReturn(counterDocument);
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("8")).thenReturn(customerDocument);
        when(transaction.get(counterDocument)).thenReturn(ApiFutures.immediateFuture(counterSnapshot));
        when(counterSnapshot.exists()).thenReturn(true);
        when(counterSnapshot.getLong("lastId")).thenReturn(7L);
        IllegalStateException aborted = new IllegalStateException("transaction aborted");
        runTransactionCallbackThen(aborted);
        Customer customer = Customer.builder().fullName("Ada Lovelace").build();

        PersistenceException ex = assertThrows(PersistenceException.class, () -> repository.create(customer));

        assertSame(aborted, ex.getCause());
        assertNull(customer.getId());
    }

    @Test
    void update_ShouldUnwrapExecutionFailure() {
        IllegalStateException unavailable = new IllegalStateException("UNAVAILABLE");
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("3")).thenReturn(customerDocument);
        when(customerDocument.set(anyMap())).thenReturn(ApiFutures.immediateFailedFuture(unavailable));

        PersistenceException ex = assertThrows(PersistenceException.class,
                () -> repository.update(Customer.builder().id(3).fullName("Ada Lovelace").build()));

        assertSame(unavailable, ex.getCause());
        assertEquals(500, ex.getStatus().value());
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void findById_ShouldRestoreInterruptFlag() throws Exception {
        @SuppressWarnings("unchecked")
        ApiFuture<DocumentSnapshot> pending = mock(ApiFuture.class);
        when(pending.get()).thenThrow(new InterruptedException());
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("5")).thenReturn(customerDocument);
        when(customerDocument.get()).thenReturn(pending);

        assertThrows(PersistenceException.class, () -> repository.findById(5));

        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void findById_ShouldReturnEmptyForMissingDocument() {
        DocumentSnapshot missing = mock(DocumentSnapshot.class);
        when(missing.exists()).thenReturn(false);
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("5")).thenReturn(customerDocument);
        when(customerDocument.get()).thenReturn(ApiFutures.immediateFuture(missing));

        assertTrue(repository.findById(5).isEmpty());
    }

    @Test
    void deleteById_ShouldReturnDeletedId() {
        when(firestore.collection("customers")).thenReturn(customersCollection);
        when(customersCollection.document("9")).thenReturn(customerDocument);
        when(customerDocument.delete()).thenReturn(ApiFutures.immediateFuture(null));

        assertEquals(9, repository.deleteById(9));
    }

    @Test
    void toData_ShouldStoreFirestoreFriendlyValues() {
        Customer customer = Customer.builder()
                .id(3)
                .fullName("Ada Lovelace")
                .dateOfBirth(LocalDate.of(1815, 12, 10))
                .age(36)
                .addresses(List.of(Address.builder().line1("St James's Square").city("London")
                        .postalCode("SW1Y 4JU").country("GB").build()))
                .createdAt(LocalDateTime.of(2025, 1, 2, 10, 15, 30))
                .build();

        Map<String, Object> data = CustomerRepository.toData(customer);

        assertEquals(3L, data.get("id"));
        assertEquals("1815-12-10", data.get("dateOfBirth"));
        assertEquals(36L, data.get("age"));
        assertEquals("2025-01-02T10:15:30", data.get("createdAt"));
        assertNull(data.get("updatedAt"));
        assertEquals(1, ((List<?>) data.get("addresses")).size());
    }

    @Test
    void fromData_ShouldReadFirestoreDocument() {
        Map<String, Object> address = new HashMap<>();
        address.put("type", "WORK");
        address.put("line1", "1 Infinite Loop");
        address.put("city", "Cupertino");
        address.put("state", "CA");
        address.put("postalCode", "95014");
        address.put("country", "US");

        Map<String, Object> data = new HashMap<>();
        data.put("id", 12L);
        data.put("fullName", "Grace Hopper");
        data.put("dateOfBirth", "1906-12-09");
        data.put("age", 85L);
        data.put("addresses", List.of(address));
        data.put("createdAt", "2025-01-02T10:15:30");

        Customer customer = CustomerRepository.fromData(data);

        assertEquals(12, customer.getId());
        assertEquals("Grace Hopper", customer.getFullName());
        assertEquals(LocalDate.of(1906, 12, 9), customer.getDateOfBirth());
        assertEquals(85, customer.getAge());
        assertEquals("CA", customer.getAddresses().get(0).getState());
        assertNull(customer.getAddresses().get(0).getLine2());
        assertEquals(LocalDateTime.of(2025, 1, 2, 10, 15, 30), customer.getCreatedAt());
        assertNull(customer.getUpdatedAt());
    }

    @Test
    void fromData_ShouldTolerateMissingOptionalFields() {
        Map<String, Object> data = new HashMap<>();
        data.put("id", 1L);
        data.put("fullName", "Alan Turing");

        Customer customer = CustomerRepository.fromData(data);

        assertEquals(1, customer.getId());
        assertNull(customer.getDateOfBirth());
        assertEquals(0, customer.getAge());
        assertTrue(customer.getAddresses().isEmpty());
    }

    /**
     * Runs the transaction body against the mocked transaction, then completes
     * with its result or with the given failure.
     */
    @SuppressWarnings("unchecked")
    private void runTransactionCallbackThen(Throwable failure) {
        when(firestore.runTransaction(any(Transaction.Function.class))).thenAnswer(invocation -> {
            Transaction.Function<Object> body = invocation.getArgument(0);
            Object result = body.updateCallback(transaction);
            return failure == null ? ApiFutures.immediateFuture(result) : ApiFutures.immediateFailedFuture(failure);
        });
    }
}
