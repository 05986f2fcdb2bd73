package com.example.walmartcrawling.output;

import com.example.walmartcrawling.config.ScraperProperties;
import com.example.walmartcrawling.entity.Product;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

/**
 * 상품 CSV 보조 저장소
 * 
 * 완료된 상품을 한 줄씩 scraper.csv.path 파일에 추가합니다.
 * 헤더는 파일이 없거나 비어 있을 때만 씁니다.
 * 
 * 쓰기 실패는 로그로만 남기며, DB에 저장된 작업/상품에는 영향을 주지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductCsvExporter {

    static final String[] HEADERS = {
            "client_name", "category", "task_id",
            "title", "price",
            "images", "about_this_item",
            "colors", "sizes",
            "product_url", "related_links",
            "scraped_at"
    };

    /** 여러 값을 가진 칸의 구분자 */
    static final String VALUE_SEPARATOR = " | ";

    private static final DateTimeFormatter SCRAPED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ScraperProperties properties;

    /**
     * 상품 한 건을 CSV에 추가
     * 
     * @param product 저장된 상품
     * @return 기록했으면 true, 비활성화되어 있거나 실패했으면 false
     */
    public synchronized boolean append(Product product) {
        ScraperProperties.Csv csv = properties.getCsv();
        if (!csv.isEnabled()) {
            return false;
        }
        File file = new File(csv.getPath());
        boolean writeHeader = !file.exists() || file.length() == 0;

        // 상위 디렉토리는 openOutputStream이 생성
        try (CSVWriter writer = new CSVWriter(
                new OutputStreamWriter(FileUtils.openOutputStream(file, true), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (writeHeader) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(product));

            log.info("[Task {}] CSV 저장 완료: {}", product.getTask().getId(), file.getPath());
            return true;

        } catch (IOException | RuntimeException e) {
            log.error("[Task {}] CSV 저장 실패 ({}): {}", product.getTask().getId(), file.getPath(), e.getMessage(), e);
            return false;
        }
    }

    private String[] toRow(Product p) {
        return new String[]{
                str(p.getClientName()),
                str(p.getCategory()),
                str(p.getTask().getId()),
                str(p.getTitle()),
                p.getPrice() != null ? p.getPrice().toString() : str(p.getPriceText()),
                join(p.getImages()),
                join(p.getAboutThisItem()),
                join(p.getColors()),
                join(p.getSizes()),
                str(p.getProductUrl()),
                join(p.getRelatedLinks()),
                p.getScrapedAt() == null ? "" : p.getScrapedAt().format(SCRAPED_AT_FORMAT)
        };
    }

    private String join(Collection<String> values) {
        return values == null ? "" : String.join(VALUE_SEPARATOR, values);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
