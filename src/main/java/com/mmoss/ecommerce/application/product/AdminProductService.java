package com.mmoss.ecommerce.application.product;

import com.mmoss.ecommerce.application.common.AccessGuard;
import com.mmoss.ecommerce.application.product.dto.ProductCommand;
import com.mmoss.ecommerce.common.exception.PersistenceException;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.product.CategoryLimitExceededException;
import com.mmoss.ecommerce.domain.product.DuplicateProductException;
import com.mmoss.ecommerce.domain.product.InvalidProductException;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AdminProductService - 관리자 상품 관리 (Application 계층)
 *
 * 책임:
 * - 상품 추가/수정/삭제, 목록 조회
 * - 상품 규칙 검증 (가격, 회원가, 재고, 필수 필드, 식품 유통기한)
 * - 카탈로그 카테고리 수 상한 검증
 *
 * 비즈니스 규칙:
 * - 모든 작업은 관리자만 가능
 * - 변경은 검증 통과 후 저장 (실패 시 카탈로그 변경 없음)
 * - 삭제는 과거 주문에 영향을 주지 않음 (주문은 스냅샷 보관)
 */
@Service
public class AdminProductService {

    private static final Logger log = LoggerFactory.getLogger(AdminProductService.class);

    private final ProductRepository productRepository;
    private final ShopPolicy shopPolicy;

    public AdminProductService(ProductRepository productRepository, ShopPolicy shopPolicy) {
        this.productRepository = productRepository;
        this.shopPolicy = shopPolicy;
    }

    /**
     * @throws DuplicateProductException 이미 존재하는 SKU
     * @throws InvalidProductException 상품 규칙 위반
     * @throws CategoryLimitExceededException 카테고리 수 상한 초과
     */
    public Product addProduct(User admin, ProductCommand command) {
        AccessGuard.requireAdmin(admin);
        String sku = Product.normalizeSku(command.getSku());
        if (sku == null || sku.isBlank()) {
            throw new InvalidProductException("SKU is required");
        }
        if (productRepository.findByKey(sku).isPresent()) {
            throw new DuplicateProductException(sku);
        }

        Product product = Product.builder()
                .sku(sku)
                .name(trimOrNull(command.getName()))
                .brand(trimOrNull(command.getBrand()))
                .description(command.getDescription() == null ? "" : command.getDescription().trim())
                .category(trimOrNull(command.getCategory()))
                .subcategory(trimOrNull(command.getSubcategory()))
                .price(command.getPrice())
                .memberPrice(command.getMemberPrice())
                .stock(command.getStock() == null ? 0 : command.getStock())
                .food(Boolean.TRUE.equals(command.getFood()))
                .expiryDate(command.getExpiryDate())
                .ingredients(trimOrNull(command.getIngredients()))
                .storage(trimOrNull(command.getStorage()))
                .allergens(trimOrNull(command.getAllergens()))
                .build();
        validate(product);
        checkCategoryLimit(product.getCategory(), null);

        productRepository.upsert(product);
        saveOrRollback(() -> productRepository.deleteByKey(product.getSku()));
        log.info("[AdminProductService] 상품 추가: sku={}, category={}", product.getSku(), product.getCategory());
        return product;
    }

    /**
     * 부분 수정 (null/공백 필드는 기존 값 유지)
     *
     * @throws ProductNotFoundException 존재하지 않는 SKU
     * @throws InvalidProductException 상품 규칙 위반
     * @throws CategoryLimitExceededException 카테고리 수 상한 초과
     */
    public Product editProduct(User admin, String sku, ProductCommand changes) {
        AccessGuard.requireAdmin(admin);
        Product existing = productRepository.findByKey(sku)
                .orElseThrow(() -> new ProductNotFoundException(Product.normalizeSku(sku)));

        Product updated = existing.toBuilder()
                .name(keep(changes.getName(), existing.getName()))
                .brand(keep(changes.getBrand(), existing.getBrand()))
                .description(keep(changes.getDescription(), existing.getDescription()))
                .category(keep(changes.getCategory(), existing.getCategory()))
                .subcategory(keep(changes.getSubcategory(), existing.getSubcategory()))
                .price(changes.getPrice() != null ? changes.getPrice() : existing.getPrice())
                .memberPrice(changes.getMemberPrice() != null ? changes.getMemberPrice() : existing.getMemberPrice())
                .stock(changes.getStock() != null ? changes.getStock() : existing.getStock())
                .food(changes.getFood() != null ? changes.getFood() : existing.isFood())
                .expiryDate(changes.getExpiryDate() != null ? changes.getExpiryDate() : existing.getExpiryDate())
                .ingredients(keep(changes.getIngredients(), existing.getIngredients()))
                .storage(keep(changes.getStorage(), existing.getStorage()))
                .allergens(keep(changes.getAllergens(), existing.getAllergens()))
                .build();
        validate(updated);
        checkCategoryLimit(updated.getCategory(), existing.getSku());

        productRepository.upsert(updated);
        saveOrRollback(() -> productRepository.upsert(existing));
        log.info("[AdminProductService] 상품 수정: sku={}", updated.getSku());
        return updated;
    }

    /**
     * @throws ProductNotFoundException 존재하지 않는 SKU
     */
    public void deleteProduct(User admin, String sku) {
        AccessGuard.requireAdmin(admin);
        Product existing = productRepository.findByKey(sku)
                .orElseThrow(() -> new ProductNotFoundException(Product.normalizeSku(sku)));
        productRepository.deleteByKey(existing.getSku());
        saveOrRollback(() -> productRepository.upsert(existing));
        log.info("[AdminProductService] 상품 삭제: sku={}", existing.getSku());
    }

    public List<Product> listProducts(User admin, ProductFilter filter) {
        AccessGuard.requireAdmin(admin);
        return productRepository.findByFilter(filter);
    }

    /**
     * 저장 실패 시 캐시 변경을 되돌리고 예외를 다시 던진다.
     */
    private void saveOrRollback(Runnable rollback) {
        try {
            productRepository.saveAll();
        } catch (PersistenceException e) {
            log.error("[AdminProductService] 카탈로그 저장 실패, 변경 취소", e);
            rollback.run();
            throw e;
        }
    }

    private void validate(Product product) {
        try {
            product.validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidProductException(e.getMessage());
        }
    }

    /**
     * 새 카테고리를 추가하면 상한을 넘는지 검사 (대소문자 무시)
     *
     * @param excludedSku 수정 대상 상품 (자기 자신의 기존 카테고리는 제외하고 계산)
     */
    private void checkCategoryLimit(String category, String excludedSku) {
        Set<String> otherCategories = productRepository.findByFilter(ProductFilter.none()).stream()
                .filter(p -> excludedSku == null || !p.getSku().equals(excludedSku))
                .map(p -> p.getCategory().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String normalized = category.toLowerCase(Locale.ROOT);
        if (!otherCategories.contains(normalized) && otherCategories.size() >= shopPolicy.getMaxCategories()) {
            throw new CategoryLimitExceededException(category, shopPolicy.getMaxCategories());
        }
    }

    private static String keep(String candidate, String current) {
        return candidate == null || candidate.isBlank() ? current : candidate.trim();
    }

    private static String trimOrNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
