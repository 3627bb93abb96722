package com.productcatalog.api.controller;

import com.productcatalog.api.dto.ApiResponse;
import com.productcatalog.api.dto.BrandDto;
import com.productcatalog.api.dto.CreateBrandRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateBrandRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.service.BrandService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for brands.
 */
@RestController
@RequestMapping("/brands")
@Validated
public class BrandController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BrandController.class);

    private final BrandService brandService;

    @Autowired
    public BrandController(BrandService brandService) {
        this.brandService = brandService;
    }

    /**
     * List brands in name order.
     * GET /brands?limit={limit}&last_key={token}
     */
    @GetMapping
    public ResponseEntity<ApiResponse<PageResponse<BrandDto>>> listBrands(
            @RequestParam(required = false) @Min(value = 1, message = "Limit must be at least 1") Integer limit,
            @RequestParam(name = "last_key", required = false) String lastKey) {

        PageResponse<BrandDto> page = brandService.listBrands(limit, lastKey);
        logger.debug("Listed {} brands", page.getItems().size());
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    @GetMapping("/{brandId}")
    public ResponseEntity<ApiResponse<BrandDto>> getBrand(@PathVariable String brandId) {
        return ResponseEntity.ok(ApiResponse.success(brandService.getBrand(brandId)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<BrandDto>> createBrand(@Valid @RequestBody CreateBrandRequest request) {
        BrandDto brand = brandService.createBrand(request);
        logger.info("Brand {} created", brand.getId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.of("Brand created successfully", brand));
    }

    @PutMapping("/{brandId}")
    public ResponseEntity<ApiResponse<BrandDto>> updateBrand(@PathVariable String brandId,
                                                             @Valid @RequestBody UpdateBrandRequest request) {
        BrandDto brand = brandService.updateBrand(brandId, request);
        return ResponseEntity.ok(ApiResponse.of("Brand updated successfully", brand));
    }

    @DeleteMapping("/{brandId}")
    public ResponseEntity<ApiResponse<Void>> deleteBrand(@PathVariable String brandId) {
        if (!brandService.deleteBrand(brandId)) {
            throw new NotFoundException("Brand not found");
        }
        return ResponseEntity.ok(ApiResponse.message("Brand deleted successfully"));
    }
}
