package io.b2mash.s3manager.storageconfig;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One lock per owner, serializing registry writes for that owner across transaction commit. Locks
 * are weakly held and disappear once no thread references them.
 */
@Component
public class OwnerLocks {

  private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

  public <T> T withLock(String ownerId, Supplier<T> work) {
    ReentrantLock lock = locks.get(ownerId, key -> new ReentrantLock());
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
