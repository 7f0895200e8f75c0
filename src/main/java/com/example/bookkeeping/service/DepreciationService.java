package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Company;
import com.example.bookkeeping.domain.FixedAsset;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.LedgerValidationException;
import com.example.bookkeeping.exception.RecordNotFoundException;
import com.example.bookkeeping.repository.FixedAssetRepository;

/**
 * Maintains the fixed asset register and runs straight-line monthly depreciation. Each run posts
 * one journal transaction and updates the asset's accumulated depreciation in the same unit.
 */
@Service
@Transactional
public class DepreciationService {

  private static final Logger log = LoggerFactory.getLogger(DepreciationService.class);

  private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");

  private final FixedAssetRepository fixedAssetRepository;
  private final PostingService postingService;

  public DepreciationService(
      FixedAssetRepository fixedAssetRepository, PostingService postingService) {
    this.fixedAssetRepository = fixedAssetRepository;
    this.postingService = postingService;
  }

  /**
   * Adds an asset to the register. The asset must already belong to {@code company}.
   *
   * @param paymentAccountCode account credited for the purchase; when given, an acquisition
   *     transaction debiting the asset account is posted as well
   */
  public FixedAsset registerAsset(Company company, FixedAsset asset, String paymentAccountCode) {
    validateAsset(asset);
    if (!sameCompany(company, asset.getCompany())) {
      throw new LedgerValidationException("Asset belongs to a different company");
    }
    if (paymentAccountCode != null && isBlank(asset.getAssetAccountCode())) {
      throw new LedgerValidationException("An asset account is required to record the purchase");
    }
    FixedAsset saved = fixedAssetRepository.save(asset);

    if (paymentAccountCode != null) {
      postingService.createTransaction(
          company,
          new TransactionDraft(
              saved.getAcquisitionDate(),
              "ACQ-" + saved.getId(),
              "Acquisition of asset: " + saved.getName(),
              List.of(
                  TransactionDraft.Line.debit(saved.getAssetAccountCode(), saved.getCost()),
                  TransactionDraft.Line.credit(paymentAccountCode, saved.getCost()))));
    }
    log.info(
        "Registered fixed asset {} ({}) for company {}",
        saved.getId(),
        saved.getName(),
        company.getId());
    return saved;
  }

  @Transactional(readOnly = true)
  public List<FixedAsset> findAssets(Company company) {
    return fixedAssetRepository.findByCompanyOrderByAcquisitionDateDesc(company);
  }

  @Transactional(readOnly = true)
  public Optional<FixedAsset> findAsset(Company company, Long assetId) {
    return fixedAssetRepository.findByIdAndCompany(assetId, company);
  }

  /**
   * Amount the next monthly run would post: {@code (cost - residual) / (life * 12)}, capped at the
   * remaining depreciable value. A missing life counts as one year.
   */
  public BigDecimal calculateMonthlyDepreciation(FixedAsset asset) {
    int lifeYears =
        asset.getUsefulLifeYears() != null && asset.getUsefulLifeYears() > 0
            ? asset.getUsefulLifeYears()
            : 1;
    BigDecimal monthly =
        asset
            .getCost()
            .subtract(asset.getResidualValue())
            .divide(MONTHS_PER_YEAR.multiply(BigDecimal.valueOf(lifeYears)), 2, RoundingMode.HALF_UP);
    BigDecimal remaining = asset.getBookValue().subtract(asset.getResidualValue());
    BigDecimal amount = monthly.min(remaining);
    return amount.signum() > 0 ? amount : BigDecimal.ZERO;
  }

  /**
   * Posts one month of depreciation for the asset.
   *
   * @param date transaction date, the last day of the current month when null
   * @throws LedgerValidationException if the asset is not depreciable, has no depreciation
   *     accounts or is already fully depreciated
   */
  public DepreciationRun runMonthlyDepreciation(Company company, Long assetId, LocalDate date) {
    FixedAsset asset =
        fixedAssetRepository
            .findByIdAndCompany(assetId, company)
            .orElseThrow(() -> new RecordNotFoundException("Fixed asset not found: " + assetId));

    if (!asset.isDepreciable()) {
      throw new LedgerValidationException("Asset " + assetId + " is not depreciable");
    }
    if (isBlank(asset.getExpenseAccountCode())
        || isBlank(asset.getAccumulatedDepreciationAccountCode())) {
      throw new LedgerValidationException(
          "Asset " + assetId + " has no depreciation expense or accumulated depreciation account");
    }
    if (asset.isFullyDepreciated()) {
      throw new LedgerValidationException("Asset " + assetId + " is fully depreciated");
    }
    BigDecimal amount = calculateMonthlyDepreciation(asset);
    if (amount.signum() == 0) {
      throw new LedgerValidationException("No depreciation to post for asset " + assetId);
    }

    LocalDate postingDate = date != null ? date : YearMonth.now().atEndOfMonth();
    Transaction transaction =
        postingService.createTransaction(
            company,
            new TransactionDraft(
                postingDate,
                "DEP-" + asset.getId(),
                "Monthly depreciation for asset: " + asset.getName(),
                List.of(
                    TransactionDraft.Line.debit(asset.getExpenseAccountCode(), amount),
                    TransactionDraft.Line.credit(
                        asset.getAccumulatedDepreciationAccountCode(), amount))));

    asset.addDepreciation(amount);
    fixedAssetRepository.save(asset);
    log.info(
        "Depreciated asset {} by {} on {}, book value now {}",
        asset.getId(),
        amount,
        postingDate,
        asset.getBookValue());
    return new DepreciationRun(asset, transaction, amount);
  }

  private static void validateAsset(FixedAsset asset) {
    if (asset == null) {
      throw new LedgerValidationException("Asset is required");
    }
    if (isBlank(asset.getName())) {
      throw new LedgerValidationException("Asset name is required");
    }
    if (asset.getCost() == null || asset.getCost().signum() <= 0) {
      throw new LedgerValidationException("Asset cost must be positive");
    }
    if (asset.getAcquisitionDate() == null) {
      throw new LedgerValidationException("Acquisition date is required");
    }
    BigDecimal residual = asset.getResidualValue();
    if (residual == null || residual.signum() < 0 || residual.compareTo(asset.getCost()) > 0) {
      throw new LedgerValidationException("Residual value must be between zero and the cost");
    }
    if (asset.getUsefulLifeYears() != null && asset.getUsefulLifeYears() <= 0) {
      throw new LedgerValidationException("Useful life must be positive");
    }
    if (asset.isDepreciable()
        && (isBlank(asset.getExpenseAccountCode())
            || isBlank(asset.getAccumulatedDepreciationAccountCode()))) {
      throw new LedgerValidationException(
          "A depreciable asset needs an expense and an accumulated depreciation account");
    }
  }

  private static boolean sameCompany(Company company, Company other) {
    if (company == other) {
      return true;
    }
    return company != null
        && other != null
        && company.getId() != null
        && company.getId().equals(other.getId());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public record DepreciationRun(FixedAsset asset, Transaction transaction, BigDecimal amount) {}
}
