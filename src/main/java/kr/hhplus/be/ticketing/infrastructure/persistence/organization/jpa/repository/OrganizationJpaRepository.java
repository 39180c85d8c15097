package kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.repository;

import jakarta.persistence.LockModeType;
import kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.entity.OrganizationJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OrganizationJpaRepository extends JpaRepository<OrganizationJpaEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from OrganizationJpaEntity o where o.address = :address")
    Optional<OrganizationJpaEntity> findForUpdate(@Param("address") String address);
}
