package com.mmoss.ecommerce.infrastructure.persistence.product;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.mmoss.ecommerce.config.ShopPolicy;
import com.mmoss.ecommerce.domain.common.vo.Money;
import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.AbstractCsvRepository;
import com.mmoss.ecommerce.infrastructure.persistence.common.CsvFileStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * CsvProductRepository - products.csv 기반 상품 저장소
 */
@Repository
public class CsvProductRepository extends AbstractCsvRepository<Product, ProductRow> implements ProductRepository {

    public static final String FILE_NAME = "products.csv";

    @Autowired
    public CsvProductRepository(ShopPolicy shopPolicy, CsvMapper csvMapper) {
        this(Path.of(shopPolicy.getDataDir(), FILE_NAME), csvMapper);
    }

    public CsvProductRepository(Path file, CsvMapper csvMapper) {
        super(new CsvFileStore<>(file, ProductRow.class, csvMapper));
    }

    @Override
    public boolean deleteByKey(String sku) {
        return removeFromCache(sku) != null;
    }

    @Override
    public List<Product> findByFilter(ProductFilter filter) {
        ProductFilter effective = filter == null ? ProductFilter.none() : filter;
        return cachedValues().stream()
                .filter(effective::matches)
                .sorted(ProductFilter.DISPLAY_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findCategories() {
        TreeSet<String> categories = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        cachedValues().forEach(p -> categories.add(p.getCategory()));
        return List.copyOf(categories);
    }

    @Override
    protected String normalizeKey(String key) {
        return Product.normalizeSku(key);
    }

    @Override
    protected String keyOf(Product product) {
        return product.getSku();
    }

    @Override
    protected Product toDomain(ProductRow row) {
        String expiry = blankToNull(row.getExpiryDate());
        Product product = Product.builder()
                .sku(Product.normalizeSku(row.getSku()))
                .name(blankToNull(row.getName()))
                .brand(blankToNull(row.getBrand()))
                .description(nullToEmpty(row.getDescription()))
                .category(blankToNull(row.getCategory()))
                .subcategory(blankToNull(row.getSubcategory()))
                .price(Money.of(row.getPrice()))
                .memberPrice(Money.of(row.getMemberPrice()))
                .stock(Integer.parseInt(row.getQuantity().trim()))
                .food(parseBoolean(row.getFood()))
                .expiryDate(expiry == null ? null : LocalDate.parse(expiry))
                .ingredients(blankToNull(row.getIngredients()))
                .storage(blankToNull(row.getStorage()))
                .allergens(blankToNull(row.getAllergens()))
                .build();
        product.validate();
        return product;
    }

    @Override
    protected ProductRow toRow(Product product) {
        ProductRow row = new ProductRow();
        row.setSku(product.getSku());
        row.setName(product.getName());
        row.setBrand(product.getBrand());
        row.setDescription(nullToEmpty(product.getDescription()));
        row.setCategory(product.getCategory());
        row.setSubcategory(product.getSubcategory());
        row.setPrice(product.getPrice().toPlainString());
        row.setMemberPrice(product.getMemberPrice().toPlainString());
        row.setQuantity(String.valueOf(product.getStock()));
        row.setFood(String.valueOf(product.isFood()));
        row.setExpiryDate(product.getExpiryDate() == null ? "" : product.getExpiryDate().toString());
        row.setIngredients(nullToEmpty(product.getIngredients()));
        row.setStorage(nullToEmpty(product.getStorage()));
        row.setAllergens(nullToEmpty(product.getAllergens()));
        return row;
    }

    private static boolean parseBoolean(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1");
    }
}
