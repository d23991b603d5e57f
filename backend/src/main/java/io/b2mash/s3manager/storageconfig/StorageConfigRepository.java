package io.b2mash.s3manager.storageconfig;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StorageConfigRepository extends JpaRepository<StorageConfig, String> {

  @Query(
      "SELECT c FROM StorageConfig c WHERE c.ownerId = :ownerId ORDER BY c.createdAt ASC, c.id ASC")
  List<StorageConfig> findByOwner(@Param("ownerId") String ownerId);

  /** Same as {@link #findByOwner(String)} but takes row locks for a read-modify-write. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      "SELECT c FROM StorageConfig c WHERE c.ownerId = :ownerId ORDER BY c.createdAt ASC, c.id ASC")
  List<StorageConfig> lockByOwner(@Param("ownerId") String ownerId);

  @Query("SELECT c FROM StorageConfig c WHERE c.id = :id AND c.ownerId = :ownerId")
  Optional<StorageConfig> findByIdAndOwner(
      @Param("id") String id, @Param("ownerId") String ownerId);

  @Query("SELECT c FROM StorageConfig c ORDER BY c.ownerId ASC, c.createdAt ASC, c.id ASC")
  List<StorageConfig> findAllForExport();
}
