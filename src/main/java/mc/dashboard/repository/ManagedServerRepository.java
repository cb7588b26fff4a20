package mc.dashboard.repository;

import mc.dashboard.model.ManagedServer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ManagedServerRepository extends JpaRepository<ManagedServer, Long> {
}
