package com.hhplus.storefront.infrastructure.config;

import com.hhplus.storefront.application.catalog.CatalogAdminService;
import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.domain.catalog.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 데모용 카탈로그 데이터 적재
 *
 * storefront.sample-data.enabled=true일 때만 등록되며, 카테고리가 하나라도 있으면 건너뛴다.
 */
@Component
@ConditionalOnProperty(prefix = "storefront.sample-data", name = "enabled", havingValue = "true")
public class SampleCatalogLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleCatalogLoader.class);

    private final CatalogAdminService catalogAdminService;
    private final CategoryRepository categoryRepository;

    public SampleCatalogLoader(CatalogAdminService catalogAdminService,
                               CategoryRepository categoryRepository) {
        this.catalogAdminService = catalogAdminService;
        this.categoryRepository = categoryRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!categoryRepository.findAllOrderByName().isEmpty()) {
            log.info("[SampleCatalogLoader] 기존 카탈로그가 있어 샘플 데이터 적재를 건너뜁니다");
            return;
        }

        catalogAdminService.createCategory("Books", "books");
        catalogAdminService.createCategory("Electronics", "electronics");
        catalogAdminService.createCategory("Home", "home");

        product("books", "Clean Code", "clean-code", "A handbook of agile software craftsmanship", "32.50", 20);
        product("books", "Refactoring", "refactoring", "Improving the design of existing code", "41.00", 12);
        product("electronics", "Wireless Mouse", "wireless-mouse", "2.4GHz ergonomic mouse", "18.90", 50);
        product("electronics", "Mechanical Keyboard", "mechanical-keyboard", "Tenkeyless, brown switches", "89.00", 8);
        product("home", "Ceramic Mug", "ceramic-mug", "350ml, dishwasher safe", "9.99", 100);

        log.info("[SampleCatalogLoader] 샘플 카탈로그 적재 완료 - categories=3, products=5");
    }

    private void product(String categorySlug, String name, String slug, String description, String price, int stock) {
        catalogAdminService.createProduct(CreateProductCommand.builder()
                .categorySlug(categorySlug)
                .name(name)
                .slug(slug)
                .description(description)
                .price(new BigDecimal(price))
                .stock(stock)
                .build());
    }
}
