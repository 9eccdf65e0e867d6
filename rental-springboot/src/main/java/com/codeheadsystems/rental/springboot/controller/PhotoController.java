package com.codeheadsystems.rental.springboot.controller;

import com.codeheadsystems.rental.model.MessageResponse;
import com.codeheadsystems.rental.model.photo.Photo;
import com.codeheadsystems.rental.server.manager.PhotoManager;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rental/api/photos")
public class PhotoController {

  private final PhotoManager photoManager;

  public PhotoController(PhotoManager photoManager) {
    this.photoManager = photoManager;
  }

  @GetMapping("/{userId}")
  public List<Photo> listForUser(@PathVariable String userId) {
    return photoManager.listForUser(userId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public Photo add(@RequestBody Photo photo) {
    return photoManager.add(photo);
  }

  @DeleteMapping
  public MessageResponse delete(@RequestParam String filepath) {
    photoManager.delete(filepath);
    return new MessageResponse("Photo deleted");
  }
}
