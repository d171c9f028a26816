package com.example.orchestrator.infrastructure.persistence.repository;

import com.example.orchestrator.infrastructure.persistence.entity.OrderEntity;
import com.example.orchestrator.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, Long> {

    /**
     * @return number of rows updated, 0 if the order does not exist
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :status WHERE o.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") OrderStatusEnum status);
}
