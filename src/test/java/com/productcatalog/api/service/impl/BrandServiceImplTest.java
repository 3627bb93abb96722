package com.productcatalog.api.service.impl;

import com.productcatalog.api.dto.BrandDto;
import com.productcatalog.api.dto.CreateBrandRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateBrandRequest;
import com.productcatalog.api.exception.DatabaseException;
import com.productcatalog.api.exception.DuplicateException;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.exception.ValidationException;
import com.productcatalog.api.repository.BrandRepository;
import com.productcatalog.api.testutil.CatalogFixture;
import com.productcatalog.api.testutil.CatalogTestData;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.validation.BrandValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("BrandServiceImpl Tests")
class BrandServiceImplTest {

    private CatalogFixture fixture;
    private BrandServiceImpl brandService;

    @BeforeEach
    void setUp() {
        fixture = new CatalogFixture();
        brandService = fixture.brandService;
    }

    @Nested
    class CreateBrand {

        @Test
        void createBrand_ValidRequest_CanBeReadBack() {
            BrandDto created = brandService.createBrand(
                new CreateBrandRequest("  Acme  ", "A fine acme brand indeed", "https://acme.example.com"));

            assertThat(created.getId()).isNotBlank();
            assertThat(created.getName()).isEqualTo("Acme");
            assertThat(created.getCreatedAt()).isNotBlank();

            BrandDto loaded = brandService.getBrand(created.getId());
            assertThat(loaded).isEqualTo(created);
        }

        @Test
        void createBrand_StoresIndexAttributes() {
            BrandDto created = brandService.createBrand(CatalogTestData.brand("Acme"));

            String pk = CatalogKeyFactory.getBrandPk(created.getId());
            var item = fixture.table.rawItem(pk, pk).orElseThrow();
            assertThat(item.get("GSI3PK").s()).isEqualTo("BRAND_LIST");
            assertThat(item.get("GSI3SK").s()).isEqualTo("ACME");
            assertThat(item.get("entity_type").s()).isEqualTo("brand");
            assertThat(item).doesNotContainKey("website");
        }

        @Test
        void createBrand_NameDiffersOnlyByCaseAndWhitespace_ThrowsDuplicate() {
            brandService.createBrand(CatalogTestData.brand("Acme"));

            assertThatThrownBy(() -> brandService.createBrand(CatalogTestData.brand("  aCME ")))
                .isInstanceOf(DuplicateException.class)
                .hasMessage("Brand name 'aCME' already exists");
            assertThat(brandService.listBrands(null, null).getItems()).hasSize(1);
        }

        @Test
        void createBrand_NamePrefixOfExistingName_IsNotADuplicate() {
            brandService.createBrand(CatalogTestData.brand("Acme Corp"));

            BrandDto created = brandService.createBrand(CatalogTestData.brand("Acme"));

            assertThat(created.getName()).isEqualTo("Acme");
        }

        @Test
        void createBrand_NameTooShort_ThrowsValidation() {
            assertThatThrownBy(() -> brandService.createBrand(CatalogTestData.brand("A")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Brand name must be at least 2 characters long");
        }

        @Test
        void createBrand_DescriptionBoundary() {
            assertThatThrownBy(() -> brandService.createBrand(new CreateBrandRequest("Acme", "123456789", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Brand description must be at least 10 characters long");

            assertThat(brandService.createBrand(new CreateBrandRequest("Acme", "1234567890", null)).getDescription())
                .isEqualTo("1234567890");
        }

        @Test
        void createBrand_BlankWebsite_StoresNone() {
            BrandDto created = brandService.createBrand(
                new CreateBrandRequest("Acme", "A fine acme brand indeed", "   "));

            assertThat(created.getWebsite()).isNull();
            String pk = CatalogKeyFactory.getBrandPk(created.getId());
            assertThat(fixture.table.rawItem(pk, pk).orElseThrow()).doesNotContainKey("website");
        }
    }

    @Nested
    class UpdateBrand {

        private BrandDto acme;

        @BeforeEach
        void createBrand() {
            acme = brandService.createBrand(
                new CreateBrandRequest("Acme", "A fine acme brand indeed", "https://acme.example.com"));
        }

        @Test
        void updateBrand_Rename_RecomputesSortKey() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setName("Zenith");

            BrandDto updated = brandService.updateBrand(acme.getId(), request);

            assertThat(updated.getName()).isEqualTo("Zenith");
            assertThat(updated.getDescription()).isEqualTo("A fine acme brand indeed");
            assertThat(updated.getCreatedAt()).isEqualTo(acme.getCreatedAt());
            String pk = CatalogKeyFactory.getBrandPk(acme.getId());
            assertThat(fixture.table.rawItem(pk, pk).orElseThrow().get("GSI3SK").s()).isEqualTo("ZENITH");
        }

        @Test
        void updateBrand_SameNameDifferentCase_ExcludesItself() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setName("ACME");

            assertThat(brandService.updateBrand(acme.getId(), request).getName()).isEqualTo("ACME");
        }

        @Test
        void updateBrand_NameOfAnotherBrand_ThrowsDuplicate() {
            brandService.createBrand(CatalogTestData.brand("Globex"));
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setName("globex");

            assertThatThrownBy(() -> brandService.updateBrand(acme.getId(), request))
                .isInstanceOf(DuplicateException.class);
            assertThat(brandService.getBrand(acme.getId()).getName()).isEqualTo("Acme");
        }

        @Test
        void updateBrand_EmptyWebsite_RemovesWebsite() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setWebsite("");

            BrandDto updated = brandService.updateBrand(acme.getId(), request);

            assertThat(updated.getWebsite()).isNull();
            assertThat(brandService.getBrand(acme.getId()).getWebsite()).isNull();
        }

        @Test
        void updateBrand_ExplicitNullWebsite_RemovesWebsite() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setWebsite(null);

            assertThat(brandService.updateBrand(acme.getId(), request).getWebsite()).isNull();
        }

        @Test
        void updateBrand_ExplicitNullName_ThrowsRequired() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setName(null);

            assertThatThrownBy(() -> brandService.updateBrand(acme.getId(), request))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Brand name is required");
            assertThat(brandService.getBrand(acme.getId()).getName()).isEqualTo("Acme");
        }

        @Test
        void updateBrand_ExplicitNullDescription_ThrowsRequired() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setDescription(null);

            assertThatThrownBy(() -> brandService.updateBrand(acme.getId(), request))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Brand description is required");
        }

        @Test
        void updateBrand_UnknownFields_ThrowsValidationListingThem() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setName("Other");
            request.addUnknownField("logo", "x");
            request.addUnknownField("color", "red");

            assertThatThrownBy(() -> brandService.updateBrand(acme.getId(), request))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid fields: color, logo");
        }

        @Test
        void updateBrand_NoFields_ThrowsValidation() {
            assertThatThrownBy(() -> brandService.updateBrand(acme.getId(), new UpdateBrandRequest()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No valid fields to update");
        }

        @Test
        void updateBrand_UnknownBrand_ThrowsNotFound() {
            UpdateBrandRequest request = new UpdateBrandRequest();
            request.setDescription("Another fine description");

            assertThatThrownBy(() -> brandService.updateBrand(CatalogTestData.UNKNOWN_ID, request))
                .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class DeleteAndList {

        @Test
        void deleteBrand_Twice_SecondCallReturnsFalse() {
            BrandDto acme = brandService.createBrand(CatalogTestData.brand("Acme"));

            assertThat(brandService.deleteBrand(acme.getId())).isTrue();
            assertThat(brandService.deleteBrand(acme.getId())).isFalse();
            assertThat(brandService.brandExists(acme.getId())).isFalse();
            assertThatThrownBy(() -> brandService.getBrand(acme.getId())).isInstanceOf(NotFoundException.class);
        }

        @Test
        void deleteBrand_NeverCreated_ReturnsFalse() {
            assertThat(brandService.deleteBrand(CatalogTestData.UNKNOWN_ID)).isFalse();
        }

        @Test
        void listBrands_PagesOfOne_ConcatenateToNameOrder() {
            for (String name : List.of("delta", "Alpha", "charlie", "Bravo")) {
                brandService.createBrand(CatalogTestData.brand(name));
            }

            List<String> names = new ArrayList<>();
            String token = null;
            int pages = 0;
            do {
                PageResponse<BrandDto> page = brandService.listBrands(1, token);
                assertThat(page.getItems()).hasSize(1);
                page.getItems().forEach(brand -> names.add(brand.getName()));
                token = page.getNextToken();
                pages++;
            } while (token != null);

            assertThat(pages).isEqualTo(4);
            assertThat(names).containsExactly("Alpha", "Bravo", "charlie", "delta");
            assertThat(brandService.listBrands(null, null).getItems())
                .extracting(BrandDto::getName)
                .containsExactlyElementsOf(names);
        }

        @Test
        void listBrands_LimitBelowOne_ThrowsValidation() {
            assertThatThrownBy(() -> brandService.listBrands(0, null))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    void createBrand_StoreFailureDuringNameCheck_Propagates() {
        BrandRepository failingRepository = mock(BrandRepository.class);
        when(failingRepository.existsByName(anyString(), isNull()))
            .thenThrow(new DatabaseException("Failed to query index: timeout"));
        BrandServiceImpl service = new BrandServiceImpl(failingRepository, new BrandValidator(),
            new PageSizePolicy(fixture.properties));

        assertThatThrownBy(() -> service.createBrand(CatalogTestData.brand("Acme")))
            .isInstanceOf(DatabaseException.class);
        verify(failingRepository, never()).create(any());
    }
}
