package com.example.handparse.infrastructure.text;

import com.example.handparse.domain.exception.HandTextRequiredException;
import com.example.handparse.infrastructure.exception.HandTextReadException;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Infrastructure helper that turns an uploaded hand history file into text.
 * PokerStars writes its history files as UTF-8, usually with a byte order mark.
 */
@Component
public class HandTextReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads an uploaded file as UTF-8 and strips a leading byte order mark.
     *
     * @param file uploaded hand history file
     * @return file contents
     * @throws HandTextRequiredException when no file or an empty file was uploaded
     * @throws HandTextReadException     when the upload cannot be read
     */
    public String read(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new HandTextRequiredException();
        }
        try {
            return stripByteOrderMark(new String(file.getBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new HandTextReadException("Unable to read the uploaded hand history " + file.getOriginalFilename(), e);
        }
    }

    static String stripByteOrderMark(String text) {
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            return text.substring(1);
        }
        return text;
    }
}
