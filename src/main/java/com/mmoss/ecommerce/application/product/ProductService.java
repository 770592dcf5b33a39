package com.mmoss.ecommerce.application.product;

import com.mmoss.ecommerce.domain.product.Product;
import com.mmoss.ecommerce.domain.product.ProductFilter;
import com.mmoss.ecommerce.domain.product.ProductNotFoundException;
import com.mmoss.ecommerce.domain.product.ProductRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * ProductService - 상품 조회 (고객/관리자 공용, 읽기 전용)
 */
@Service
public class ProductService {

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public List<Product> browse(ProductFilter filter) {
        return productRepository.findByFilter(filter);
    }

    /**
     * @throws ProductNotFoundException 존재하지 않는 SKU
     */
    public Product getProduct(String sku) {
        return productRepository.findByKey(sku)
                .orElseThrow(() -> new ProductNotFoundException(Product.normalizeSku(sku)));
    }

    public List<String> listCategories() {
        return productRepository.findCategories();
    }

    public List<String> listSubcategories(String category) {
        return distinct(ProductFilter.builder().category(category).build(), Product::getSubcategory);
    }

    public List<String> listBrands() {
        return distinct(ProductFilter.none(), Product::getBrand);
    }

    private List<String> distinct(ProductFilter filter, Function<Product, String> field) {
        TreeSet<String> values = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        productRepository.findByFilter(filter).forEach(p -> values.add(field.apply(p)));
        return List.copyOf(values);
    }
}
