package com.qasandbox.infrastructure.catalog;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<ProductEntity, Long>, JpaSpecificationExecutor<ProductEntity> {

  Optional<ProductEntity> findBySku(String sku);

  /**
   * Row-locks the given products (SELECT ... FOR UPDATE) in ascending id order,
   * so concurrent stock reservations on overlapping products queue up instead of deadlocking.
   * Must run inside a transaction.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select p from ProductEntity p where p.id in :ids order by p.id asc")
  List<ProductEntity> lockAllByIdIn(@Param("ids") Collection<Long> ids);

  @Modifying
  @Query("update ProductEntity p set p.categoryId = null where p.categoryId = :categoryId")
  int detachFromCategory(@Param("categoryId") Long categoryId);
}
