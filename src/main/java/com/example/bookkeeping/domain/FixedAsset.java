package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A fixed asset in the asset register. Depreciable assets are written down monthly on a
 * straight-line basis, each run posting a journal transaction against the configured expense and
 * accumulated depreciation accounts.
 */
@Entity
@Table(
    name = "fixed_asset",
    indexes = {@Index(name = "idx_fixed_asset_company", columnList = "company_id")})
public class FixedAsset {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Size(max = 150)
  @Column(nullable = false, length = 150)
  private String name;

  @Size(max = 100)
  @Column(length = 100)
  private String category;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal cost;

  @NotNull
  @Column(name = "acquisition_date", nullable = false)
  private LocalDate acquisitionDate;

  /** Useful life in years; null means not set. */
  @Column(name = "useful_life_years")
  private Integer usefulLifeYears;

  @NotNull
  @Column(name = "residual_value", nullable = false, precision = 19, scale = 2)
  private BigDecimal residualValue = BigDecimal.ZERO;

  @Column(nullable = false)
  private boolean depreciable = false;

  @NotNull
  @Column(name = "accumulated_depreciation", nullable = false, precision = 19, scale = 2)
  private BigDecimal accumulatedDepreciation = BigDecimal.ZERO;

  @Size(max = 20)
  @Column(name = "asset_account_code", length = 20)
  private String assetAccountCode;

  @Size(max = 20)
  @Column(name = "expense_account_code", length = 20)
  private String expenseAccountCode;

  @Size(max = 20)
  @Column(name = "accumulated_depreciation_account_code", length = 20)
  private String accumulatedDepreciationAccountCode;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public FixedAsset() {}

  public FixedAsset(Company company, String name, BigDecimal cost, LocalDate acquisitionDate) {
    this.company = company;
    this.name = name;
    this.cost = cost;
    this.acquisitionDate = acquisitionDate;
  }

  public BigDecimal getBookValue() {
    return cost.subtract(accumulatedDepreciation);
  }

  public boolean isFullyDepreciated() {
    return getBookValue().compareTo(residualValue) <= 0;
  }

  public void addDepreciation(BigDecimal amount) {
    this.accumulatedDepreciation = this.accumulatedDepreciation.add(amount);
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Company getCompany() {
    return company;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  public BigDecimal getCost() {
    return cost;
  }

  public void setCost(BigDecimal cost) {
    this.cost = cost;
  }

  public LocalDate getAcquisitionDate() {
    return acquisitionDate;
  }

  public void setAcquisitionDate(LocalDate acquisitionDate) {
    this.acquisitionDate = acquisitionDate;
  }

  public Integer getUsefulLifeYears() {
    return usefulLifeYears;
  }

  public void setUsefulLifeYears(Integer usefulLifeYears) {
    this.usefulLifeYears = usefulLifeYears;
  }

  public BigDecimal getResidualValue() {
    return residualValue;
  }

  public void setResidualValue(BigDecimal residualValue) {
    this.residualValue = residualValue;
  }

  public boolean isDepreciable() {
    return depreciable;
  }

  public void setDepreciable(boolean depreciable) {
    this.depreciable = depreciable;
  }

  public BigDecimal getAccumulatedDepreciation() {
    return accumulatedDepreciation;
  }

  public void setAccumulatedDepreciation(BigDecimal accumulatedDepreciation) {
    this.accumulatedDepreciation = accumulatedDepreciation;
  }

  public String getAssetAccountCode() {
    return assetAccountCode;
  }

  public void setAssetAccountCode(String assetAccountCode) {
    this.assetAccountCode = assetAccountCode;
  }

  public String getExpenseAccountCode() {
    return expenseAccountCode;
  }

  public void setExpenseAccountCode(String expenseAccountCode) {
    this.expenseAccountCode = expenseAccountCode;
  }

  public String getAccumulatedDepreciationAccountCode() {
    return accumulatedDepreciationAccountCode;
  }

  public void setAccumulatedDepreciationAccountCode(String accumulatedDepreciationAccountCode) {
    this.accumulatedDepreciationAccountCode = accumulatedDepreciationAccountCode;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
