package com.example.bookkeeping.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.FixedAsset;

@Repository
public interface FixedAssetRepository extends JpaRepository<FixedAsset, Long> {

  List<FixedAsset> findByCompanyOrderByAcquisitionDateDesc(Company company);

  Optional<FixedAsset> findByIdAndCompany(Long id, Company company);
}
