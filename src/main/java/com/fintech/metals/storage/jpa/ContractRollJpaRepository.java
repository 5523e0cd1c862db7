package com.fintech.metals.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContractRollJpaRepository extends JpaRepository<ContractRollEntity, String> {
}
