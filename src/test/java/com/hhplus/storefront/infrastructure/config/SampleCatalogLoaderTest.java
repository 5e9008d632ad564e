package com.hhplus.storefront.infrastructure.config;

import com.hhplus.storefront.application.catalog.CatalogAdminService;
import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.catalog.CategoryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SampleCatalogLoader 단위 테스트")
class SampleCatalogLoaderTest {

    @Mock
    private CatalogAdminService catalogAdminService;

    @Mock
    private CategoryRepository categoryRepository;

    @InjectMocks
    private SampleCatalogLoader loader;

    @Test
    @DisplayName("빈 카탈로그 - 카테고리 3개, 상품 5개 등록")
    void testRun_EmptyCatalog() {
        // Given
        when(categoryRepository.findAllOrderByName()).thenReturn(List.of());

        // When
        loader.run(new DefaultApplicationArguments());

        // Then
        verify(catalogAdminService, times(3)).createCategory(anyString(), anyString());
        ArgumentCaptor<CreateProductCommand> captor = ArgumentCaptor.forClass(CreateProductCommand.class);
        verify(catalogAdminService, times(5)).createProduct(captor.capture());
        assertTrue(captor.getAllValues().stream().allMatch(c -> c.getPrice().scale() == 2));
        assertEquals("clean-code", captor.getAllValues().get(0).getSlug());
    }

    @Test
    @DisplayName("기존 카탈로그가 있으면 건너뜀")
    void testRun_ExistingCatalog() {
        when(categoryRepository.findAllOrderByName())
                .thenReturn(List.of(TestDataFactory.createCategory(1L, "Books", "books")));

        loader.run(new DefaultApplicationArguments());

        verifyNoInteractions(catalogAdminService);
    }
}
