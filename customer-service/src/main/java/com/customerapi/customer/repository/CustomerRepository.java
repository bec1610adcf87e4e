package com.customerapi.customer.repository;

import com.customerapi.common.exception.PersistenceException;
import com.customerapi.customer.model.Address;
import com.customerapi.customer.model.Customer;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Repository for customers stored in Firebase.
 *
 * Data access only - NO business logic here.
 *
 * Structure in Firebase:
 * customers/{id}: {
 *   "id": 42,
 *   "fullName": "Jane Doe",
 *   "dateOfBirth": "1990-05-17",
 *   "age": 35,
 *   "addresses": [ { "type": "HOME", "line1": "...", "city": "...", "postalCode": "...", "country": "GB" } ],
 *   "createdAt": "2025-01-02T10:15:30",
 *   "updatedAt": "2025-01-02T10:15:30"
 * }
 * counters/customers: { "lastId": 42 }
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CustomerRepository {

    private static final String COLLECTION = "customers";
    private static final String COUNTERS_COLLECTION = "counters";
    private static final String COUNTER_DOCUMENT = "customers";
    private static final String COUNTER_FIELD = "lastId";

    private final Firestore firestore;

    /**
     * Get all customers.
     */
    public List<Customer> findAll() {
        try {
            List<Customer> customers = new ArrayList<>();

            for (QueryDocumentSnapshot document : firestore.collection(COLLECTION).get().get().getDocuments()) {
                customers.add(fromData(document.getData()));
            }

            return customers;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("fetch all customers", e);
        } catch (ExecutionException e) {
            throw failure("fetch all customers", e);
        }
    }

    /**
     * Find customer by identifier.
     */
    public Optional<Customer> findById(int id) {
        try {
            DocumentSnapshot snapshot = document(id).get().get();

            if (!snapshot.exists() || snapshot.getData() == null) {
                return Optional.empty();
            }

            return Optional.of(fromData(snapshot.getData()));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("fetch customer " + id, e);
        } catch (ExecutionException e) {
            throw failure("fetch customer " + id, e);
        }
    }

    /**
     * Store a new customer under the next free identifier.
     * Counter increment and insert run in one transaction.
     */
    public Customer create(Customer customer) {
        DocumentReference counterRef = firestore.collection(COUNTERS_COLLECTION).document(COUNTER_DOCUMENT);

        try {
            int id = firestore.runTransaction(transaction -> {
                DocumentSnapshot counter = transaction.get(counterRef).get();
                Long lastId = counter.exists() ? counter.getLong(COUNTER_FIELD) : null;
                int nextId = (lastId == null ? 0 : lastId.intValue()) + 1;

                customer.setId(nextId);
                transaction.set(counterRef, Map.<String, Object>of(COUNTER_FIELD, (long) nextId));
                transaction.set(document(nextId), toData(customer));
                return nextId;
            }).get();

            customer.setId(id);
            log.debug("Created customer: {}", id);
            return customer;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            customer.setId(null);
            throw failure("create customer", e);
        } catch (ExecutionException e) {
            customer.setId(null);
            throw failure("create customer", e);
        }
    }

    /**
     * Overwrite an existing customer document.
     */
    public Customer update(Customer customer) {
        try {
            document(customer.getId()).set(toData(customer)).get();
            log.debug("Updated customer: {}", customer.getId());
            return customer;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("update customer " + customer.getId(), e);
        } catch (ExecutionException e) {
            throw failure("update customer " + customer.getId(), e);
        }
    }

    /**
     * Delete customer by identifier.
     *
     * @return the deleted identifier
     */
    public int deleteById(int id) {
        try {
            document(id).delete().get();
            log.debug("Deleted customer: {}", id);
            return id;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("delete customer " + id, e);
        } catch (ExecutionException e) {
            throw failure("delete customer " + id, e);
        }
    }

    // Private helper methods

    private DocumentReference document(int id) {
        return firestore.collection(COLLECTION).document(String.valueOf(id));
    }

    private PersistenceException failure(String action, Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        log.error("Failed to {}: {}", action, cause.getMessage());
        return new PersistenceException("Failed to " + action, cause);
    }

    static Map<String, Object> toData(Customer customer) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", customer.getId() == null ? null : customer.getId().longValue());
        data.put("fullName", customer.getFullName());
        data.put("dateOfBirth", customer.getDateOfBirth() == null ? null : customer.getDateOfBirth().toString());
        data.put("age", (long) customer.getAge());
        data.put("createdAt", customer.getCreatedAt() == null ? null : customer.getCreatedAt().toString());
        data.put("updatedAt", customer.getUpdatedAt() == null ? null : customer.getUpdatedAt().toString());

        List<Map<String, Object>> addresses = new ArrayList<>();
        if (customer.getAddresses() != null) {
            for (Address address : customer.getAddresses()) {
                Map<String, Object> addressData = new HashMap<>();
                addressData.put("type", address.getType());
                addressData.put("line1", address.getLine1());
                addressData.put("line2", address.getLine2());
                addressData.put("city", address.getCity());
                addressData.put("state", address.getState());
                addressData.put("postalCode", address.getPostalCode());
                addressData.put("country", address.getCountry());
                addresses.add(addressData);
            }
        }
        data.put("addresses", addresses);

        return data;
    }

    static Customer fromData(Map<String, Object> data) {
        List<Address> addresses = new ArrayList<>();
        Object addressValue = data.get("addresses");
        if (addressValue instanceof List<?> addressList) {
            for (Object entry : addressList) {
                if (entry instanceof Map<?, ?> addressData) {
                    addresses.add(Address.builder()
                            .type((String) addressData.get("type"))
                            .line1((String) addressData.get("line1"))
                            .line2((String) addressData.get("line2"))
                            .city((String) addressData.get("city"))
                            .state((String) addressData.get("state"))
                            .postalCode((String) addressData.get("postalCode"))
                            .country((String) addressData.get("country"))
                            .build());
                }
            }
        }

        Object idValue = data.get("id");
        Object ageValue = data.get("age");
        String dateOfBirth = (String) data.get("dateOfBirth");
        String createdAt = (String) data.get("createdAt");
        String updatedAt = (String) data.get("updatedAt");

        return Customer.builder()
                .id(idValue instanceof Number idNumber ? idNumber.intValue() : null)
                .fullName((String) data.get("fullName"))
                .dateOfBirth(dateOfBirth == null ? null : LocalDate.parse(dateOfBirth))
                .age(ageValue instanceof Number ageNumber ? ageNumber.intValue() : 0)
                .addresses(addresses)
                .createdAt(createdAt == null ? null : LocalDateTime.parse(createdAt))
                .updatedAt(updatedAt == null ? null : LocalDateTime.parse(updatedAt))
                .build();
    }
}
